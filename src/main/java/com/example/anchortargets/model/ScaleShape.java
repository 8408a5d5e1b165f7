package com.example.anchortargets.model;

public record ScaleShape(double scale, ImageShape shape) {}

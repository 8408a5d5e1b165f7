package com.example.anchortargets.controller.dto;

import java.util.List;

public record DatabaseSummary(int records, int totalAnchors, List<ImageLabelStats> images) {}

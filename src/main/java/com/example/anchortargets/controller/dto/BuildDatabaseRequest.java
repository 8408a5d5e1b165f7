package com.example.anchortargets.controller.dto;

import java.util.ArrayList;
import java.util.List;

public class BuildDatabaseRequest {
    private List<ImageAnnotation> images = new ArrayList<>();

    // null keeps the configured anchors.add-flipped
    private Boolean addFlipped;

    public List<ImageAnnotation> getImages() { return images; }
    public void setImages(List<ImageAnnotation> images) { this.images = images; }

    public Boolean getAddFlipped() { return addFlipped; }
    public void setAddFlipped(Boolean addFlipped) { this.addFlipped = addFlipped; }
}

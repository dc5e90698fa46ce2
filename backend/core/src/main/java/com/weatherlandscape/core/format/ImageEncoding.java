package com.weatherlandscape.core.format;

public enum ImageEncoding {
    PNG("png", ".png", "image/png"),
    BMP("bmp", ".bmp", "image/bmp");

    private final String imageIoName;
    private final String extension;
    private final String mimeType;

    ImageEncoding(String imageIoName, String extension, String mimeType) {
        this.imageIoName = imageIoName;
        this.extension = extension;
        this.mimeType = mimeType;
    }

    public String imageIoName() {
        return imageIoName;
    }

    public String extension() {
        return extension;
    }

    public String mimeType() {
        return mimeType;
    }
}

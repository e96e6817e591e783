package com.abba.rxreminder.domain.service;

public interface PrescriptionVisionClient {

    /**
     * Asks the vision model to read a prescription image and returns its answer untouched.
     */
    String extract(byte[] imageBytes, String mimeType);
}

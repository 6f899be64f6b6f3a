package com.mediavault.model;

/**
 * Kind of media stored in the library.
 */
public enum MediaType {
    IMAGE, VIDEO;

    public String wireName() {
        return name().toLowerCase();
    }
}

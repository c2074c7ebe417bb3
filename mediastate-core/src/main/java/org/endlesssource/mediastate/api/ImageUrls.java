package org.endlesssource.mediastate.api;

/**
 * Builds image URLs for items and users.
 */
public interface ImageUrls {

    String itemImage(String itemId);

    String userImage(String userId);
}

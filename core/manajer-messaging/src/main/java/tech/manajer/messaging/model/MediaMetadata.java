package tech.manajer.messaging.model;

/**
 * Descriptive data for a media attachment.
 *
 * Stored as an embedded document within the Message. Width and height are
 * only meaningful for images.
 */
public class MediaMetadata {

    public String filename;

    public Long size;

    public Integer width;

    public Integer height;

    public MediaMetadata() {
    }

    public MediaMetadata(String filename, Long size, Integer width, Integer height) {
        this.filename = filename;
        this.size = size;
        this.width = width;
        this.height = height;
    }
}

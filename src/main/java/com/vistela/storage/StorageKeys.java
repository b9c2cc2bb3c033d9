package com.vistela.storage;

import org.apache.commons.io.FilenameUtils;
import org.springframework.util.StringUtils;

public final class StorageKeys {

    private StorageKeys() {
    }

    /**
     * {@code folder/name}, or {@code name} when the folder is null, empty or only slashes.
     */
    public static String join(String folder, String name) {
        if (folder == null) {
            return name;
        }
        String trimmed = StringUtils.trimTrailingCharacter(StringUtils.trimLeadingCharacter(folder, '/'), '/');
        if (trimmed.isEmpty()) {
            return name;
        }
        return trimmed + "/" + name;
    }

    /**
     * Object name for a video: the video id plus the lower-cased extension of the client filename,
     * so two uploads of "clip.mp4" by different videos never collide.
     */
    public static String forVideo(String videoId, String filename) {
        String extension = filename == null ? "" : FilenameUtils.getExtension(filename);
        if (extension.isEmpty()) {
            return videoId;
        }
        return videoId + "." + extension.toLowerCase();
    }
}

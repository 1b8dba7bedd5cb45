package com.example.zipcatalog.model;

import org.apache.tika.mime.MediaType;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse file-type bucket derived from a detected media type.
 */
public enum FileCategory {
    VIDEO,
    IMAGE,
    AUDIO,
    DOCUMENT,
    ARCHIVE,
    OTHER;

    private static final Set<String> DOCUMENT_SUBTYPES = Set.of(
            "pdf",
            "msword",
            "rtf",
            "vnd.ms-excel",
            "vnd.ms-powerpoint",
            "json",
            "xml"
    );
    private static final Set<String> ARCHIVE_SUBTYPES = Set.of(
            "zip",
            "gzip",
            "x-tar",
            "x-gtar",
            "x-7z-compressed",
            "x-rar-compressed",
            "vnd.rar",
            "x-bzip2",
            "x-xz"
    );

    public static FileCategory fromMediaType(MediaType mediaType) {
        if (mediaType == null) {
            return OTHER;
        }
        String type = mediaType.getType();
        String subtype = mediaType.getSubtype();
        switch (type) {
            case "video":
                return VIDEO;
            case "image":
                return IMAGE;
            case "audio":
                return AUDIO;
            case "text":
                return DOCUMENT;
            case "application":
                if (ARCHIVE_SUBTYPES.contains(subtype)) {
                    return ARCHIVE;
                }
                if (DOCUMENT_SUBTYPES.contains(subtype)
                        || subtype.startsWith("vnd.openxmlformats")
                        || subtype.startsWith("vnd.oasis.opendocument")) {
                    return DOCUMENT;
                }
                return OTHER;
            default:
                return OTHER;
        }
    }

    /**
     * Lenient parse used by configuration and the command line ("video", "Video", "VIDEO").
     */
    public static FileCategory parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

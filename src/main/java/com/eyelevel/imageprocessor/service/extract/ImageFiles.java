package com.eyelevel.imageprocessor.service.extract;

import org.apache.commons.io.FilenameUtils;

import java.util.Locale;
import java.util.Set;

/**
 * Name-based checks shared by the source readers.
 */
final class ImageFiles {

    /**
     * Common, ignorable file and directory names found in archives and folders, such as macOS resource
     * forks and Windows thumbnail caches.
     */
    private static final Set<String> IGNORED_NAMES = Set.of("__MACOSX", ".DS_Store", "Thumbs.db");

    private ImageFiles() {
    }

    static String extensionOf(String name) {
        return FilenameUtils.getExtension(name).toLowerCase(Locale.ROOT);
    }

    static boolean hasImageExtension(String name, ExtractionOptions options) {
        return options.validExtensions().contains(extensionOf(name));
    }

    static boolean isArchive(String name) {
        return ArchiveFormat.of(name).isPresent();
    }

    /**
     * @param normalizedPath a forward-slash separated relative path
     * @return {@code true} when any path segment is a known system name or the file is an AppleDouble fork.
     */
    static boolean isIgnored(String normalizedPath) {
        final String fileName = FilenameUtils.getName(normalizedPath);
        if (fileName.startsWith("._")) {
            return true;
        }
        for (String segment : normalizedPath.split("/")) {
            if (IGNORED_NAMES.contains(segment)) {
                return true;
            }
        }
        return false;
    }
}

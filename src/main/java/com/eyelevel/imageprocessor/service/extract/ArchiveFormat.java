package com.eyelevel.imageprocessor.service.extract;

import org.apache.commons.io.FilenameUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Archive kinds recognised by name, both as sources and as entries inside other archives.
 */
enum ArchiveFormat {
    ZIP("_zip", ".zip"),
    TAR("_tar", ".tar"),
    TAR_GZ("_tar", ".tar.gz", ".tgz");

    private final String folderSuffix;
    private final List<String> extensions;

    ArchiveFormat(String folderSuffix, String... extensions) {
        this.folderSuffix = folderSuffix;
        this.extensions = List.of(extensions);
    }

    static Optional<ArchiveFormat> of(String name) {
        final String fileName = FilenameUtils.getName(name).toLowerCase(Locale.ROOT);
        for (ArchiveFormat format : values()) {
            for (String extension : format.extensions) {
                if (fileName.endsWith(extension)) {
                    return Optional.of(format);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * The folder a nested archive is unpacked into, e.g. {@code more/inner.tar.gz -> more/inner_tar}.
     */
    String nestedFolder(String entryPath) {
        final String lower = entryPath.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension)) {
                return entryPath.substring(0, entryPath.length() - extension.length()) + folderSuffix;
            }
        }
        return entryPath + folderSuffix;
    }
}

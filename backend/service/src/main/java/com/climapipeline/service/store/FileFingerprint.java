package com.climapipeline.service.store;

import com.climapipeline.core.util.HashingUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;

record FileFingerprint(boolean exists, long size, FileTime lastModified, String sha256) {
    static final FileFingerprint ABSENT = new FileFingerprint(false, -1L, null, null);

    static FileFingerprint of(BasicFileAttributes attributes, byte[] content) {
        return new FileFingerprint(true, attributes.size(), attributes.lastModifiedTime(), HashingUtils.sha256(content));
    }

    static FileFingerprint capture(Path path) throws IOException {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return of(attributes, Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return ABSENT;
        }
    }
}

/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Utility functions shared by the data-driven tests.
 */
public class TestUtils {

    private TestUtils() {}

    /**
     * Loads every file with the given extension from a test resource directory.
     *
     * @param directory resource directory, relative to the classpath root
     * @param extension file extension including the dot, e.g. {@code ".logql"}
     * @return file contents keyed by file name without extension, sorted by name
     */
    public static NavigableMap<String, String> getResourceFilesWithExtension(String directory, String extension) throws IOException,
        URISyntaxException {
        URL url = TestUtils.class.getClassLoader().getResource(directory);
        if (url == null) {
            throw new IOException("Test resource directory not found: " + directory);
        }

        NavigableMap<String, String> files = new TreeMap<>();
        try (Stream<Path> paths = Files.list(Paths.get(url.toURI()))) {
            for (Path path : paths.filter(p -> p.getFileName().toString().endsWith(extension)).toList()) {
                String fileName = path.getFileName().toString();
                String name = fileName.substring(0, fileName.length() - extension.length());
                files.put(name, Files.readString(path, StandardCharsets.UTF_8));
            }
        }
        return files;
    }
}

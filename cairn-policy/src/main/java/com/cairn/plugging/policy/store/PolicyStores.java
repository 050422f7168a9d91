/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy.store;

import com.cairn.plugging.api.exceptions.PolicyLoadException;
import com.cairn.plugging.api.model.PolicyBundle;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystem;
import java.nio.file.FileSystemAlreadyExistsException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Factory methods for {@link PolicyBundleSource}s.
 */
public final class PolicyStores {

    /** Classpath root of the policy pack bundled with the engine. */
    public static final String BUNDLED_ROOT = "policy";
    public static final String DEFAULT_POLICY_ID = "tx.w3a";

    private PolicyStores() {
    }

    /**
     * Policy files on disk under {@code root}.
     */
    public static PolicyBundleSource directory(Path root, String policyId) {
        return new DirectorySource(root, policyId, new PolicyBundleLoader());
    }

    /**
     * Policy files packaged on the classpath under {@code resourceRoot}; works from an
     * exploded directory or from inside a jar.
     */
    public static PolicyBundleSource classpath(String resourceRoot, String policyId) {
        return new DirectorySource(resolveClasspathRoot(resourceRoot), policyId, new PolicyBundleLoader());
    }

    public static PolicyBundleSource bundled() {
        return classpath(BUNDLED_ROOT, DEFAULT_POLICY_ID);
    }

    static Path resolveClasspathRoot(String resourceRoot) {
        URL url = PolicyStores.class.getClassLoader().getResource(resourceRoot);
        if (url == null) {
            throw new PolicyLoadException("Policy resource root not found on classpath: " + resourceRoot);
        }
        try {
            URI uri = url.toURI();
            if ("jar".equals(uri.getScheme())) {
                FileSystem jarFs;
                try {
                    jarFs = FileSystems.newFileSystem(uri, Map.of());
                } catch (FileSystemAlreadyExistsException e) {
                    jarFs = FileSystems.getFileSystem(uri);
                }
                return jarFs.getPath(resourceRoot);
            }
            return Path.of(uri);
        } catch (URISyntaxException | IOException e) {
            throw new PolicyLoadException("Cannot open policy resource root " + url, e);
        }
    }

    private static final class DirectorySource implements PolicyBundleSource {
        private final Path root;
        private final String policyId;
        private final PolicyBundleLoader loader;

        DirectorySource(Path root, String policyId, PolicyBundleLoader loader) {
            this.root = Objects.requireNonNull(root, "root");
            this.policyId = Objects.requireNonNull(policyId, "policyId");
            this.loader = loader;
        }

        @Override
        public PolicyBundle load() {
            return loader.load(root, policyId);
        }

        @Override
        public String currentVersion() {
            return loader.peekVersion(root, policyId);
        }

        @Override
        public String describe() {
            return policyId + "@" + root;
        }
    }
}

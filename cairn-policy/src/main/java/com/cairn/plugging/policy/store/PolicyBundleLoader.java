/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.policy.store;

import com.cairn.plugging.api.exceptions.PolicyLoadException;
import com.cairn.plugging.api.model.CountyCentroid;
import com.cairn.plugging.api.model.PolicyBundle;
import com.cairn.plugging.api.model.PolicyPack;
import com.cairn.plugging.policy.CountyNames;
import com.cairn.plugging.policy.DistrictCodes;
import com.cairn.plugging.policy.FieldNames;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads a policy directory into an immutable {@link PolicyBundle}.
 *
 * <h2>Layout</h2>
 * <pre>
 * {root}/{policy_id}.yaml                         base pack
 * {root}/district_overlays/{district}__auto.yml   district overlay (may hold a counties map)
 * {root}/district_overlays/{district}__{county}.yml
 * {root}/county_centroids.json                    [{county, latitude, longitude}]
 * </pre>
 *
 * <p>Every overlay is parsed eagerly, so a malformed file fails the whole load instead of
 * surfacing later during a well's resolution. A missing centroid table only disables the
 * geospatial field fallbacks.
 */
public class PolicyBundleLoader {
    private static final Logger logger = Logger.getLogger(PolicyBundleLoader.class.getName());

    public static final String OVERLAY_DIR = "district_overlays";
    public static final String CENTROIDS_FILE = "county_centroids.json";
    private static final String AUTO_SUFFIX = "auto";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public PolicyBundle load(Path root, String policyId) {
        Path basePath = basePackPath(root, policyId);
        PolicyPack pack = parsePack(readTree(basePath), policyId);

        Map<String, Map<String, Object>> districtFiles = new LinkedHashMap<>();
        Map<String, Map<String, Object>> countyFiles = new LinkedHashMap<>();
        for (Path overlay : overlayFiles(root.resolve(OVERLAY_DIR))) {
            String stem = stem(overlay);
            int split = stem.indexOf("__");
            if (split <= 0) {
                logger.warning("Ignoring overlay file without a district prefix: " + overlay.getFileName());
                continue;
            }
            String district = DistrictCodes.normalize(stem.substring(0, split));
            String scope = stem.substring(split + 2);
            Map<String, Object> tree = readTree(overlay);
            if (AUTO_SUFFIX.equalsIgnoreCase(scope)) {
                districtFiles.put(district, tree);
            } else {
                countyFiles.put(district + "__" + CountyNames.fileKey(scope), tree);
            }
        }

        List<CountyCentroid> centroids = readCentroids(root.resolve(CENTROIDS_FILE));
        logger.info(String.format("Loaded policy %s version %s from %s: %d district overlays, %d county overlays, %d centroids",
            pack.policyId(), pack.version(), root, districtFiles.size(), countyFiles.size(), centroids.size()));
        return new PolicyBundle(pack, districtFiles, countyFiles, centroids, root.toString());
    }

    public String peekVersion(Path root, String policyId) {
        Object version = readTree(basePackPath(root, policyId)).get("version");
        if (version == null) {
            throw new PolicyLoadException("Policy pack " + policyId + " has no version");
        }
        return String.valueOf(version);
    }

    private Path basePackPath(Path root, String policyId) {
        for (String extension : List.of(".yaml", ".yml")) {
            Path candidate = root.resolve(policyId + extension);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        throw new PolicyLoadException("Base policy pack not found: " + root.resolve(policyId + ".yaml"));
    }

    @SuppressWarnings("unchecked")
    private PolicyPack parsePack(Map<String, Object> doc, String policyId) {
        if (!(doc.get("base") instanceof Map<?, ?> base)) {
            throw new PolicyLoadException("Policy pack " + policyId + " has no 'base' section");
        }
        Object id = doc.get("policy_id");
        Object version = doc.get("version");
        return new PolicyPack(
            id != null ? String.valueOf(id) : policyId,
            version != null ? String.valueOf(version) : null,
            stringOrNull(doc.get("jurisdiction")),
            stringOrNull(doc.get("form")),
            (Map<String, Object>) base,
            rekey(doc.get("district_overlays"), DistrictCodes::normalize, "district_overlays"),
            rekey(doc.get("county_overlays"), PolicyBundleLoader::countyKey, "county_overlays"),
            rekey(doc.get("field_overlays"), FieldNames::normalize, "field_overlays")
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> rekey(Object section, Function<String, String> normalizer,
                                                          String name) {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        if (section == null) {
            return result;
        }
        if (!(section instanceof Map<?, ?> entries)) {
            throw new PolicyLoadException("'" + name + "' must be a mapping");
        }
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> overlay)) {
                throw new PolicyLoadException("'" + name + "." + entry.getKey() + "' must be a mapping");
            }
            result.put(normalizer.apply(String.valueOf(entry.getKey())), (Map<String, Object>) overlay);
        }
        return result;
    }

    /**
     * Normalizes an inline county overlay key of the form {@code "{district}__{county}"}.
     */
    static String countyKey(String key) {
        int split = key.indexOf("__");
        if (split <= 0) {
            return key.toLowerCase(Locale.ROOT);
        }
        return DistrictCodes.normalize(key.substring(0, split)) + "__" + CountyNames.fileKey(key.substring(split + 2));
    }

    private Map<String, Object> readTree(Path file) {
        try {
            byte[] content = Files.readAllBytes(file);
            if (new String(content, StandardCharsets.UTF_8).isBlank()) {
                return new LinkedHashMap<>();
            }
            Map<String, Object> tree = yamlMapper.readValue(content, new TypeReference<LinkedHashMap<String, Object>>() { });
            return tree != null ? tree : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new PolicyLoadException("Malformed policy file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PolicyLoadException("Could not read policy file " + file, e);
        }
    }

    private List<Path> overlayFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(p -> {
                    String name = p.getFileName().toString();
                    return name.endsWith(".yml") || name.endsWith(".yaml");
                })
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PolicyLoadException("Could not list overlay directory " + dir, e);
        }
    }

    private List<CountyCentroid> readCentroids(Path file) {
        if (!Files.isRegularFile(file)) {
            logger.warning("No county centroid table at " + file + "; nearest-county field resolution disabled");
            return new ArrayList<>();
        }
        try {
            return jsonMapper.readValue(Files.readAllBytes(file), new TypeReference<List<CountyCentroid>>() { });
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Malformed county centroid table " + file, e);
            throw new PolicyLoadException("Malformed county centroid table " + file, e);
        }
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}

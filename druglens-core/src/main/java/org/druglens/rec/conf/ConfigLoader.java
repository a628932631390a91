package org.druglens.rec.conf;

/*
 * This file is part of DrugLens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * DrugLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DrugLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DrugLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.stream.Collectors;

import org.druglens.rec.util.Logger;

/**
 * Loads DrugLens settings from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/druglens.properties</code> from
 * the classpath. You can override this by setting the system property
 * <code>druglens.config</code> to an absolute path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>{@code DRUGLIB_PATH} is normalized to end with a trailing slash.</li>
 * <li>{@code DRUGLIB_FILES} is a comma separated list resolved against
 * {@code DRUGLIB_PATH}.</li>
 * <li>Use {@link #validate()} during startup to check for missing required
 * keys.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/druglens.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "druglens.config";

	// ---- Property keys -------------------------------------------------------
	private static final String K_DRUGLIB_PATH = "DRUGLIB_PATH";
	private static final String K_DRUGLIB_FILES = "DRUGLIB_FILES";
	private static final String K_CLASSIFIER_ENABLED = "CLASSIFIER_ENABLED";
	private static final String K_CLASSIFIER_ITERATIONS = "CLASSIFIER_ITERATIONS";

	public static final String DEFAULT_DRUGLIB_FILES = "drugLibTrain_raw.tsv,drugLibTest_raw.tsv";
	public static final int DEFAULT_CLASSIFIER_ITERATIONS = 100;

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			} else {
				Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
			}
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Validates presence and shape of the keys needed to start the service.
	 * This does not fail; it returns a list of human-readable issues so the
	 * caller can decide how to proceed.
	 *
	 * @return list of error strings; empty if everything looks OK
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		requireNonBlank(K_DRUGLIB_PATH, issues);

		String files = getOptional(K_DRUGLIB_FILES, null);
		if (files != null && splitList(files).isEmpty()) {
			issues.add(K_DRUGLIB_FILES + " does not name any file.");
		}

		String enabled = getOptional(K_CLASSIFIER_ENABLED, null);
		if (enabled != null && !isBooleanLiteral(enabled)) {
			issues.add(K_CLASSIFIER_ENABLED + " must be true or false, found '" + enabled + "'.");
		}

		String iterations = getOptional(K_CLASSIFIER_ITERATIONS, null);
		if (iterations != null) {
			try {
				if (Integer.parseInt(iterations) <= 0) {
					issues.add(K_CLASSIFIER_ITERATIONS + " must be a positive integer.");
				}
			} catch (NumberFormatException nfe) {
				issues.add(K_CLASSIFIER_ITERATIONS + " must be a positive integer, found '" + iterations + "'.");
			}
		}
		return issues;
	}

	/** Directory holding the drugLib review files. */
	public String getDrugLibPath() {
		return normalizedDir(getRequired(K_DRUGLIB_PATH));
	}

	/** Review files to load, resolved against {@link #getDrugLibPath()}. */
	public List<Path> getDrugLibFiles() {
		String dir = getDrugLibPath();
		return splitList(getOptional(K_DRUGLIB_FILES, DEFAULT_DRUGLIB_FILES)).stream()
				.map(name -> Path.of(dir + name))
				.collect(Collectors.toList());
	}

	/** Whether the maxent attribution model should be trained at load time. */
	public boolean isClassifierEnabled() {
		String raw = getOptional(K_CLASSIFIER_ENABLED, "true");
		return !"false".equalsIgnoreCase(raw);
	}

	/** Training iterations for the attribution model. */
	public int getClassifierIterations() {
		String raw = getOptional(K_CLASSIFIER_ITERATIONS, null);
		if (raw != null) {
			try {
				int val = Integer.parseInt(raw);
				if (val > 0) {
					return val;
				}
			} catch (NumberFormatException nfe) {
				// reported below
			}
			Logger.warn("Invalid value for {}: '{}'. Using default {}", K_CLASSIFIER_ITERATIONS, raw,
					DEFAULT_CLASSIFIER_ITERATIONS);
		}
		return DEFAULT_CLASSIFIER_ITERATIONS;
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null || v.isBlank()) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private static List<String> splitList(String raw) {
		return Arrays.stream(raw.split(","))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.collect(Collectors.toList());
	}

	private static boolean isBooleanLiteral(String v) {
		String s = v.toLowerCase(Locale.ROOT);
		return "true".equals(s) || "false".equals(s);
	}

	private String normalizedDir(String path) {
		if (path == null || path.isBlank())
			return path;
		String p = path.trim();
		if (!p.endsWith("/"))
			p = p + "/";
		return p;
	}

	private void requireNonBlank(String key, List<String> issues) {
		String v = properties.getProperty(key);
		if (v == null || v.trim().isEmpty()) {
			issues.add("Missing required property: " + key);
		}
	}
}

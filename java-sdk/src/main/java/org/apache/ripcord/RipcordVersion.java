/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.apache.ripcord;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version of the Ripcord library, read from {@code ripcord-version.properties} which Maven filters at
 * build time. Values that were left unfiltered, as when running from an IDE, are reported as
 * {@code unknown}.
 */
public final class RipcordVersion {

    private static final Logger log = LoggerFactory.getLogger(RipcordVersion.class);

    static final String PROPERTIES_FILE = "/ripcord-version.properties";
    static final String UNKNOWN = "unknown";

    private final String version;
    private final String buildTime;

    private RipcordVersion(String version, String buildTime) {
        this.version = version;
        this.buildTime = buildTime;
    }

    public static RipcordVersion getInstance() {
        return Holder.INSTANCE;
    }

    static RipcordVersion fromProperties(Properties properties) {
        return new RipcordVersion(read(properties, "version"), read(properties, "buildTime"));
    }

    private static RipcordVersion load() {
        Properties properties = new Properties();
        try (InputStream in = RipcordVersion.class.getResourceAsStream(PROPERTIES_FILE)) {
            if (in == null) {
                log.debug("No {} on the classpath", PROPERTIES_FILE);
            } else {
                properties.load(in);
            }
        } catch (IOException e) {
            log.warn("Failed to read version information from {}", PROPERTIES_FILE, e);
        }
        return fromProperties(properties);
    }

    private static String read(Properties properties, String key) {
        String value = StringUtils.trimToNull(properties.getProperty(key));
        return value == null || value.startsWith("${") ? UNKNOWN : value;
    }

    /**
     * Returns the library version.
     *
     * @return the version, e.g. {@code 0.3.0}, or {@code unknown}
     */
    public String getVersion() {
        return version;
    }

    public String getBuildTime() {
        return buildTime;
    }

    public boolean isSnapshot() {
        return version.endsWith("-SNAPSHOT");
    }

    /**
     * Returns the {@code User-Agent} sent by {@link org.apache.ripcord.transport.HttpTransport}.
     *
     * @return e.g. {@code Ripcord/0.3.0}
     */
    public String getUserAgent() {
        return "Ripcord/" + version;
    }

    @Override
    public String toString() {
        return UNKNOWN.equals(buildTime) ? "Ripcord " + version : "Ripcord " + version + " (built " + buildTime + ")";
    }

    private static final class Holder {
        private static final RipcordVersion INSTANCE = load();
    }
}

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

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class RipcordVersionTest {

    private static Properties properties(String version, String buildTime) {
        Properties properties = new Properties();
        properties.setProperty("version", version);
        properties.setProperty("buildTime", buildTime);
        return properties;
    }

    @Test
    void shouldReturnSameInstance() {
        assertThat(RipcordVersion.getInstance()).isSameAs(RipcordVersion.getInstance());
        assertThat(RipcordVersion.getInstance().getVersion()).isNotBlank();
    }

    @Test
    void shouldReadFilteredProperties() {
        // when
        RipcordVersion version = RipcordVersion.fromProperties(properties("0.3.0", "2026-10-19T08:00:00Z"));

        // then
        assertThat(version.getVersion()).isEqualTo("0.3.0");
        assertThat(version.isSnapshot()).isFalse();
        assertThat(version.getUserAgent()).isEqualTo("Ripcord/0.3.0");
        assertThat(version).hasToString("Ripcord 0.3.0 (built 2026-10-19T08:00:00Z)");
    }

    @Test
    void shouldReportUnfilteredPlaceholdersAsUnknown() {
        // when
        RipcordVersion version = RipcordVersion.fromProperties(properties("${project.version}", "${build.time}"));

        // then
        assertThat(version.getVersion()).isEqualTo(RipcordVersion.UNKNOWN);
        assertThat(version.getBuildTime()).isEqualTo(RipcordVersion.UNKNOWN);
        assertThat(version).hasToString("Ripcord unknown");
    }

    @Test
    void shouldReportMissingPropertiesAsUnknown() {
        // when
        RipcordVersion version = RipcordVersion.fromProperties(new Properties());

        // then
        assertThat(version.getVersion()).isEqualTo(RipcordVersion.UNKNOWN);
        assertThat(version.isSnapshot()).isFalse();
    }

    @Test
    void shouldRecognizeSnapshots() {
        assertThat(RipcordVersion.fromProperties(properties("0.4.0-SNAPSHOT", "")).isSnapshot()).isTrue();
    }
}

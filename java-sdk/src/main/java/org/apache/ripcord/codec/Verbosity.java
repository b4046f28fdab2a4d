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

package org.apache.ripcord.codec;


/**
 * Compactness of the generated XML.
 */
public enum Verbosity {
    NO_WHITE_SPACE("no_white_space"),
    NEWLINES_ONLY("newlines_only"),
    PRETTY("pretty");

    private final String optionValue;

    Verbosity(String optionValue) {
        this.optionValue = optionValue;
    }

    public String optionValue() {
        return optionValue;
    }

    public static Verbosity fromOptionValue(String value) {
        for (Verbosity verbosity : values()) {
            if (verbosity.optionValue.equalsIgnoreCase(value) || verbosity.name().equalsIgnoreCase(value)) {
                return verbosity;
            }
        }
        throw new IllegalArgumentException("Unknown verbosity: " + value);
    }
}

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
 * Character escaping rules applied to string content.
 */
public enum Escaping {
    /** Escape {@code & < > "}. */
    MARKUP("markup"),
    /** Write every character above 127 as a character reference. */
    NON_ASCII("non-ascii"),
    /** Write control characters other than tab, newline and carriage return as character references. */
    NON_PRINT("non-print"),
    /** Wrap string content in CDATA sections instead of escaping it. */
    CDATA("cdata");

    private final String optionValue;

    Escaping(String optionValue) {
        this.optionValue = optionValue;
    }

    public String optionValue() {
        return optionValue;
    }

    public static Escaping fromOptionValue(String value) {
        for (Escaping escaping : values()) {
            if (escaping.optionValue.equalsIgnoreCase(value) || escaping.name().equalsIgnoreCase(value)) {
                return escaping;
            }
        }
        throw new IllegalArgumentException("Unknown escaping: " + value);
    }
}

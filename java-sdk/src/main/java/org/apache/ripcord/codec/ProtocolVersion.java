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
 * The XML vocabulary spoken on the wire.
 */
public enum ProtocolVersion {
    XMLRPC("xmlrpc"),
    SOAP_1_1("soap 1.1"),
    SIMPLE("simple"),
    /** Answer in whichever vocabulary the request came in. */
    AUTO("auto");

    private final String optionValue;

    ProtocolVersion(String optionValue) {
        this.optionValue = optionValue;
    }

    public String optionValue() {
        return optionValue;
    }

    public static ProtocolVersion fromOptionValue(String value) {
        for (ProtocolVersion version : values()) {
            if (version.optionValue.equalsIgnoreCase(value) || version.name().equalsIgnoreCase(value)) {
                return version;
            }
        }
        throw new IllegalArgumentException("Unknown protocol version: " + value);
    }
}

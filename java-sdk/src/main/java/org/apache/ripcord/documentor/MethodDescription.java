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

package org.apache.ripcord.documentor;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Introspection entry of one procedure.
 *
 * @param name the public procedure name
 * @param purpose the help text as HTML paragraphs, empty when none was registered
 * @param signatures the known signatures, return type first
 */
@JsonPropertyOrder({"name", "purpose", "signatures"})
public record MethodDescription(String name, String purpose, List<List<String>> signatures) {

    public MethodDescription {
        purpose = purpose == null ? "" : purpose;
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
    }
}

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

package org.apache.ripcord.server;

import java.util.List;
import java.util.Objects;

/**
 * A registered procedure with the metadata published through introspection.
 *
 * @param name the public name, namespace-qualified once registered
 * @param procedure the procedure to invoke
 * @param description free text help, paragraphs separated by blank lines
 * @param signatures the known signatures, each listing the return type followed by the parameter types
 */
public record MethodDescriptor(String name, RpcProcedure procedure, String description, List<List<String>> signatures) {

    public MethodDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(procedure, "procedure");
        description = description == null ? "" : description;
        signatures = signatures == null ? List.of() : signatures.stream().map(List::copyOf).toList();
    }

    public MethodDescriptor(String name, RpcProcedure procedure) {
        this(name, procedure, "", List.of());
    }

    public MethodDescriptor(String name, RpcProcedure procedure, String description) {
        this(name, procedure, description, List.of());
    }

    MethodDescriptor withName(String publicName) {
        return new MethodDescriptor(publicName, procedure, description, signatures);
    }
}

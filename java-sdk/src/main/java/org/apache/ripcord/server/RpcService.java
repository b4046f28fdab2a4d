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

import java.util.ArrayList;
import java.util.List;

/**
 * A group of procedures registered together, optionally under a namespace.
 *
 * <pre>{@code
 * RpcService math = RpcService.builder()
 *     .method("add", params -> (Integer) params.get(0) + (Integer) params.get(1), "Adds two integers.")
 *     .method("_reset", params -> null)
 *     .build();
 * server.addService("math", math);   // registers math.add only
 * }</pre>
 *
 * <p>Methods whose name starts with an underscore are internal and never registered.
 */
public final class RpcService {

    private final List<MethodDescriptor> methods;

    private RpcService(List<MethodDescriptor> methods) {
        this.methods = List.copyOf(methods);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the methods of this service that are published, in declaration order.
     *
     * @return the published methods
     */
    public List<MethodDescriptor> publicMethods() {
        return methods.stream().filter(method -> !method.name().startsWith("_")).toList();
    }

    public List<MethodDescriptor> methods() {
        return methods;
    }

    public static final class Builder {

        private final List<MethodDescriptor> methods = new ArrayList<>();

        private Builder() {}

        public Builder method(String name, RpcProcedure procedure) {
            return method(new MethodDescriptor(name, procedure));
        }

        public Builder method(String name, RpcProcedure procedure, String description) {
            return method(new MethodDescriptor(name, procedure, description));
        }

        public Builder method(MethodDescriptor method) {
            methods.add(method);
            return this;
        }

        public RpcService build() {
            return new RpcService(methods);
        }
    }
}

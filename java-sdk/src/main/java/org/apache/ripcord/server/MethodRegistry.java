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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps public procedure names to their descriptors, in registration order. Registering a name again
 * replaces the previous procedure.
 */
final class MethodRegistry {

    private static final Logger log = LoggerFactory.getLogger(MethodRegistry.class);

    private final Map<String, MethodDescriptor> methods = Collections.synchronizedMap(new LinkedHashMap<>());

    void register(MethodDescriptor method) {
        if (methods.put(method.name(), method) != null) {
            log.debug("Replaced procedure {}", method.name());
        } else {
            log.debug("Registered procedure {}", method.name());
        }
    }

    Optional<MethodDescriptor> find(String name) {
        return Optional.ofNullable(methods.get(name));
    }

    /**
     * Returns a copy of the registered methods.
     *
     * @return the methods in registration order
     */
    List<MethodDescriptor> snapshot() {
        synchronized (methods) {
            return List.copyOf(methods.values());
        }
    }
}

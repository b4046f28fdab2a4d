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

package org.apache.ripcord.client;

import java.util.Optional;

/**
 * One segment of a dotted procedure name path.
 */
public interface Namespace {

    /**
     * Returns the child namespace with the given name, creating it on first access.
     *
     * @param name the segment name
     * @return the cached child namespace
     */
    Namespace child(String name);

    /**
     * Calls the procedure with the given name in this namespace.
     *
     * @param name the unqualified procedure name
     * @param args the positional arguments
     * @return the result, or a {@link Call} when the call was deferred for a batch
     */
    Object invoke(String name, Object... args);

    /**
     * Returns the dotted path of this namespace.
     *
     * @return the path, empty for the root namespace
     */
    Optional<String> path();
}

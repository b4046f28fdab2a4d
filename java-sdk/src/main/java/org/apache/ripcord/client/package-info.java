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

/**
 * Client for XML-RPC servers.
 *
 * <p>A {@link org.apache.ripcord.client.RipcordClient} is the root {@link org.apache.ripcord.client.Namespace}
 * of a remote endpoint. Child namespaces qualify procedure names ({@code client.child("a").child("b")}
 * calls {@code a.b.*}); the {@code system} namespace additionally opens a batch scope in which calls are
 * deferred into {@link org.apache.ripcord.client.Call}s and sent together with {@code system.multiCall}.
 *
 * <h2>Getting Started</h2>
 * <pre>{@code
 * var client = RipcordClient.builder()
 *     .url("http://localhost:8080/rpc")
 *     .build();
 *
 * Object sum = client.child("math").invoke("add", 1, 2);
 *
 * RipcordClient system = client.system();
 * Call first = (Call) client.system().invoke("listMethods");
 * Call second = (Call) client.child("math").invoke("add", 3, 4);
 * system.multiCall(first, second);
 * Object methods = first.result();
 * }</pre>
 */
package org.apache.ripcord.client;

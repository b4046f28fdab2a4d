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

import org.apache.ripcord.server.MethodDescriptor;
import org.apache.ripcord.server.RipcordServer;
import org.apache.ripcord.server.ServerResponse;

import java.util.List;

/**
 * Documents the procedures of a server. The server answers requests without a payload with the
 * documentor, and feeds its introspection built-ins from it.
 */
public interface Documentor {

    /**
     * Receives the registered methods. Called by the server each time it runs a request.
     *
     * @param methods a snapshot of the registered methods
     */
    void setMethodData(List<MethodDescriptor> methods);

    /**
     * Renders the documentation of the server.
     *
     * @param server the server being documented
     * @param query the query string of the request, or null
     * @return the documentation response
     */
    ServerResponse handle(RipcordServer server, String query);

    /**
     * Returns the introspection manifest of the methods last received.
     *
     * @return the manifest
     */
    IntrospectionManifest getIntrospection();
}

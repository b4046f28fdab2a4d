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

import org.apache.ripcord.codec.RpcRequest;
import org.apache.ripcord.codec.XmlRpcCodec;
import org.apache.ripcord.server.RipcordServer;
import org.apache.ripcord.transport.Transport;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;

/**
 * Posts requests straight into a server and records them.
 */
final class LoopbackTransport implements Transport, Closeable {

    private final RipcordServer server;
    private final List<RpcRequest> requests = new ArrayList<>();
    private boolean closed;

    LoopbackTransport(RipcordServer server) {
        this.server = server;
    }

    @Override
    public byte[] post(String url, byte[] request) {
        requests.add(new XmlRpcCodec().decodeRequest(request));
        return server.handle(request);
    }

    @Override
    public void close() {
        closed = true;
    }

    List<RpcRequest> requests() {
        return requests;
    }

    RpcRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    boolean isClosed() {
        return closed;
    }
}

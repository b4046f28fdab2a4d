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

import org.apache.ripcord.codec.OutputOptions;
import org.apache.ripcord.codec.RpcCodec;
import org.apache.ripcord.transport.Transport;

/**
 * State shared by every namespace node of one client: the endpoint, its collaborators and the batch
 * scope depth. Incremented each time the {@code system} namespace is entered; while it is above zero,
 * calls are deferred into {@link Call}s.
 *
 * <p>Not thread-safe; a client is meant to be used from one thread at a time.
 */
final class ClientSession {

    private final String url;
    private final Transport transport;
    private final RpcCodec codec;
    private final OutputOptions outputOptions;
    private final boolean throwExceptions;
    private final boolean autoDecode;
    private int batchDepth;

    ClientSession(
            String url,
            Transport transport,
            RpcCodec codec,
            OutputOptions outputOptions,
            boolean throwExceptions,
            boolean autoDecode) {
        this.url = url;
        this.transport = transport;
        this.codec = codec;
        this.outputOptions = outputOptions;
        this.throwExceptions = throwExceptions;
        this.autoDecode = autoDecode;
    }

    String url() {
        return url;
    }

    Transport transport() {
        return transport;
    }

    RpcCodec codec() {
        return codec;
    }

    OutputOptions outputOptions() {
        return outputOptions;
    }

    boolean throwExceptions() {
        return throwExceptions;
    }

    boolean autoDecode() {
        return autoDecode;
    }

    int batchDepth() {
        return batchDepth;
    }

    void enterBatchScope() {
        batchDepth++;
    }

    void leaveBatchScope() {
        if (batchDepth > 0) {
            batchDepth--;
        }
    }

    void resetBatchScope() {
        batchDepth = 0;
    }
}

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

import java.util.List;

/**
 * Encodes and decodes single procedure call envelopes.
 *
 * <p>Implementations map the protocol value types onto Java values: {@link java.util.Map} for structs,
 * {@link java.util.List} for arrays, {@link org.apache.ripcord.value.Base64Value} for binary blobs,
 * {@link org.apache.ripcord.value.DateTimeValue} for timestamps and {@link org.apache.ripcord.value.Fault}
 * for fault envelopes.
 */
public interface RpcCodec {

    /**
     * Encodes a procedure call.
     *
     * @param methodName the procedure name
     * @param params the positional arguments
     * @param options the output options
     * @return the request payload
     */
    byte[] encodeRequest(String methodName, List<?> params, OutputOptions options);

    /**
     * Decodes a procedure call.
     *
     * @param payload the request payload
     * @return the procedure name and arguments
     */
    RpcRequest decodeRequest(byte[] payload);

    /**
     * Encodes a response. A {@link org.apache.ripcord.value.Fault} value is encoded as a fault envelope.
     *
     * @param value the result value
     * @param options the output options
     * @return the response payload
     */
    byte[] encodeResponse(Object value, OutputOptions options);

    /**
     * Decodes a response.
     *
     * @param payload the response payload
     * @return the result value, or a {@link org.apache.ripcord.value.Fault} for a fault envelope
     */
    Object decodeResponse(byte[] payload);
}

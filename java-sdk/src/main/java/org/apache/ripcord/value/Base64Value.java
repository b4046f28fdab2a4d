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

package org.apache.ripcord.value;

import java.util.Arrays;
import java.util.Base64;

/**
 * The binary-blob value type. Decoded {@code <base64>} values are delivered as this type until they are
 * explicitly converted with {@link #bytes()} or {@code Ripcord.binary(Object)}.
 */
public final class Base64Value {

    private final byte[] data;

    public Base64Value(byte[] data) {
        this.data = data.clone();
    }

    public static Base64Value fromEncoded(String encoded) {
        return new Base64Value(Base64.getMimeDecoder().decode(encoded.trim()));
    }

    public byte[] bytes() {
        return data.clone();
    }

    public String encoded() {
        return Base64.getEncoder().encodeToString(data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Base64Value other && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Base64Value[" + data.length + " bytes]";
    }
}

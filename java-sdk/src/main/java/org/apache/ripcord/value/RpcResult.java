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

import java.util.Objects;

/**
 * The outcome of one dispatched procedure call: either a success value or a {@link Fault}.
 */
public final class RpcResult {

    private final Object value;
    private final Fault fault;

    private RpcResult(Object value, Fault fault) {
        this.value = value;
        this.fault = fault;
    }

    public static RpcResult success(Object value) {
        return new RpcResult(value, null);
    }

    public static RpcResult failure(Fault fault) {
        return new RpcResult(null, Objects.requireNonNull(fault, "fault"));
    }

    public boolean isFault() {
        return fault != null;
    }

    /**
     * Returns the success value.
     *
     * @return the value, possibly null
     * @throws IllegalStateException if this result is a fault
     */
    public Object value() {
        if (isFault()) {
            throw new IllegalStateException("Result is a fault: " + fault);
        }
        return value;
    }

    /**
     * Returns the fault.
     *
     * @return the fault
     * @throws IllegalStateException if this result is a success
     */
    public Fault fault() {
        if (!isFault()) {
            throw new IllegalStateException("Result is not a fault");
        }
        return fault;
    }

    /**
     * Returns the value that stands for this result on the wire: the value itself or the fault.
     *
     * @return value or fault
     */
    public Object toWireValue() {
        return isFault() ? fault : value;
    }

    @Override
    public String toString() {
        return isFault() ? "RpcResult[fault=" + fault + "]" : "RpcResult[value=" + value + "]";
    }
}

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Consumer;

/**
 * A deferred remote call, created instead of a network round trip when a method is called in batch
 * scope. The call is sent with {@code system.multiCall}; afterwards its result is bound to it.
 *
 * <pre>{@code
 * RipcordClient system = client.system();
 * Call methods = (Call) client.system().invoke("listMethods");
 * Call foo = (Call) client.invoke("getFoo");
 * system.multiCall(methods, foo);
 * List<?> names = (List<?>) methods.result();
 * }</pre>
 *
 * <p>A call belongs to the batch that enrolled it and cannot be sent again with another batch.
 */
public final class Call {

    public static final String METHOD_NAME = "methodName";
    public static final String PARAMS = "params";

    private final String methodName;
    private final List<Object> params;
    private Integer index;
    private Object batch;
    private boolean bound;
    private Object result;
    private Consumer<Object> binding;

    public Call(String methodName, List<?> params) {
        this.methodName = methodName;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public Call(String methodName, Object... params) {
        this(methodName, Arrays.asList(params));
    }

    public String methodName() {
        return methodName;
    }

    public List<Object> params() {
        return params;
    }

    /**
     * Returns the position of this call in its batch request.
     *
     * @return the index, empty until the call is enrolled in a batch
     */
    public OptionalInt index() {
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * Registers a callback receiving the result of this call when the batch completes.
     *
     * @param target the callback
     * @return this call, for chaining
     */
    public Call bind(Consumer<Object> target) {
        this.binding = target;
        return this;
    }

    public boolean isBound() {
        return bound;
    }

    /**
     * Returns the result bound to this call.
     *
     * @return the unwrapped result, or a {@link org.apache.ripcord.value.Fault} if the call failed
     * @throws IllegalStateException if the batch has not completed yet
     */
    public Object result() {
        if (!bound) {
            throw new IllegalStateException("No result bound to " + methodName + " yet");
        }
        return result;
    }

    /**
     * Returns the multiCall encoding of this call.
     *
     * @return a struct with {@code methodName} and {@code params}
     */
    public Map<String, Object> encode() {
        Map<String, Object> encoded = new LinkedHashMap<>();
        encoded.put(METHOD_NAME, methodName);
        encoded.put(PARAMS, params);
        return encoded;
    }

    boolean isEnrolled() {
        return index != null;
    }

    boolean isEnrolledIn(Object batch) {
        return this.batch == batch;
    }

    void enroll(Object batch, int index) {
        this.batch = batch;
        this.index = index;
    }

    void bindResult(Object value) {
        this.result = value;
        this.bound = true;
        Optional.ofNullable(binding).ifPresent(target -> target.accept(value));
    }

    @Override
    public String toString() {
        return "Call{" + methodName + params + (index == null ? "" : " @" + index) + "}";
    }
}

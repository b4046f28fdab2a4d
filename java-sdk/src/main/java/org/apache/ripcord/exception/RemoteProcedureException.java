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

package org.apache.ripcord.exception;

import org.apache.ripcord.value.Fault;

/**
 * A fault raised by a remote procedure.
 *
 * <p>On the client this is thrown when the server answers with a fault and the client was built with
 * {@code throwExceptions(true)}. On the server a procedure may throw it to answer with a fault of its
 * own choosing; the fault code is reported as is, even when it is not a {@link RipcordErrorCode}.
 */
public class RemoteProcedureException extends RipcordException {

    private final int faultCode;
    private final String faultString;

    public RemoteProcedureException(int faultCode, String faultString) {
        super(RipcordErrorCode.fromCode(faultCode), faultString);
        this.faultCode = faultCode;
        this.faultString = faultString;
    }

    public RemoteProcedureException(int faultCode, String faultString, Throwable cause) {
        super(RipcordErrorCode.fromCode(faultCode), faultString, cause);
        this.faultCode = faultCode;
        this.faultString = faultString;
    }

    public RemoteProcedureException(Fault fault) {
        this(fault.faultCode(), fault.faultString());
    }

    @Override
    public int getFaultCode() {
        return faultCode;
    }

    public String getFaultString() {
        return faultString;
    }

    /**
     * Returns the fault this exception carries.
     *
     * @return the fault record
     */
    public Fault toFault() {
        return new Fault(faultCode, faultString);
    }
}

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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteProcedureExceptionTest {

    @Test
    void shouldKeepCustomFaultCode() {
        // when
        var exception = new RemoteProcedureException(4, "Too many parameters.");

        // then
        assertThat(exception.getFaultCode()).isEqualTo(4);
        assertThat(exception.getErrorCode()).isEqualTo(RipcordErrorCode.UNKNOWN);
        assertThat(exception.getFaultString()).isEqualTo("Too many parameters.");
        assertThat(exception.toFault()).isEqualTo(new Fault(4, "Too many parameters."));
    }

    @Test
    void shouldMapKnownFaultCodeToErrorCode() {
        // when
        var exception = new RemoteProcedureException(new Fault(-1, "Procedure nope not found."));

        // then
        assertThat(exception.getErrorCode()).isEqualTo(RipcordErrorCode.METHOD_NOT_FOUND);
        assertThat(exception).hasMessage("Procedure nope not found.");
    }

    @Test
    void shouldReportErrorCodeOfOtherExceptionsAsFaultCode() {
        assertThat(new ProcedureNotFoundException("nope").getFaultCode()).isEqualTo(-1);
        assertThat(new RecursiveBatchException().getFaultCode()).isEqualTo(-3);
        assertThat(new TransportException("http://localhost:1").getFaultCode()).isEqualTo(-4);
    }
}

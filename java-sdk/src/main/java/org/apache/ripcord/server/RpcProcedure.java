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

package org.apache.ripcord.server;

import java.util.List;

/**
 * A procedure that can be called remotely.
 *
 * <p>Throwing a {@link org.apache.ripcord.exception.RemoteProcedureException} answers with a fault of the
 * procedure's choosing; any other exception is answered with a fault with code 0.
 */
@FunctionalInterface
public interface RpcProcedure {

    /**
     * Invokes the procedure.
     *
     * @param params the positional arguments decoded from the request
     * @return the result, encodable by the codec of the server
     * @throws Exception if the procedure fails
     */
    Object invoke(List<Object> params) throws Exception;
}

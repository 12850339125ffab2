/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pgfleet.kubernetes.operator.exception;

/** The replica cluster points to an external cluster that is not defined. */
public class MissingExternalSourceException extends PreconditionFailedException {

    private static final long serialVersionUID = 2267023410817592364L;

    private final String sourceName;

    public MissingExternalSourceException(String clusterName, String sourceName) {
        super(
                String.format(
                        "Missing external cluster %s, required as replication source of cluster %s",
                        sourceName, clusterName));
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}

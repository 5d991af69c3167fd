/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.projectcalico.datamodel.v1;

import org.projectcalico.annotation.PublicEvolving;

import static org.projectcalico.utils.Preconditions.checkNotNull;

/**
 * Identifies an endpoint, containing:
 *
 * <ul>
 *   <li>the host the endpoint lives on
 *   <li>the orchestrator that manages its workload
 *   <li>the id of the workload
 *   <li>the id of the endpoint within the workload
 * </ul>
 *
 * <p>Use an {@link EndpointIdFactory} to create ids whose components are canonicalized; the host
 * and orchestrator repeat for all endpoints of a host and the other components repeat over time.
 *
 * @since 0.1
 */
@PublicEvolving
public final class EndpointId {

    private final String host;
    private final String orchestrator;
    private final String workload;
    private final String endpoint;

    public EndpointId(String host, String orchestrator, String workload, String endpoint) {
        this.host = checkNotNull(host, "host must not be null.");
        this.orchestrator = checkNotNull(orchestrator, "orchestrator must not be null.");
        this.workload = checkNotNull(workload, "workload must not be null.");
        this.endpoint = checkNotNull(endpoint, "endpoint must not be null.");
    }

    public String getHost() {
        return host;
    }

    public String getOrchestrator() {
        return orchestrator;
    }

    public String getWorkload() {
        return workload;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /** Returns the key of the endpoint configuration, see {@link DataModelV1.EndpointKey}. */
    public String pathForEndpoint() {
        return DataModelV1.EndpointKey.path(host, orchestrator, workload, endpoint);
    }

    /** Returns the key of the endpoint status, see {@link DataModelV1.EndpointStatusKey}. */
    public String pathForStatus() {
        return DataModelV1.EndpointStatusKey.path(host, orchestrator, workload, endpoint);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EndpointId that = (EndpointId) o;
        return endpoint.equals(that.endpoint)
                && workload.equals(that.workload)
                && host.equals(that.host)
                && orchestrator.equals(that.orchestrator);
    }

    // host and orchestrator are not part of the hash
    @Override
    public int hashCode() {
        return endpoint.hashCode() + workload.hashCode();
    }

    @Override
    public String toString() {
        return "EndpointId{"
                + "host='"
                + host
                + '\''
                + ", orchestrator='"
                + orchestrator
                + '\''
                + ", workload='"
                + workload
                + '\''
                + ", endpoint='"
                + endpoint
                + '\''
                + '}';
    }
}

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

import org.projectcalico.annotation.Internal;
import org.projectcalico.exception.CalicoRuntimeException;
import org.projectcalico.utils.json.JsonDeserializer;
import org.projectcalico.utils.json.JsonSerializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/** Json serializer and deserializer for the {@link EndpointStatus} of an endpoint. */
@Internal
public class EndpointStatusJsonSerde
        implements JsonSerializer<EndpointStatus>, JsonDeserializer<EndpointStatus> {

    public static final EndpointStatusJsonSerde INSTANCE = new EndpointStatusJsonSerde();

    private static final String STATUS = "status";

    @Override
    public void serialize(EndpointStatus status, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeStringField(STATUS, status.getValue());
        generator.writeEndObject();
    }

    @Override
    public EndpointStatus deserialize(JsonNode node) {
        JsonNode statusNode = node.get(STATUS);
        if (statusNode == null || !statusNode.isTextual()) {
            throw new CalicoRuntimeException(
                    String.format("Missing field '%s' in endpoint status %s.", STATUS, node));
        }
        EndpointStatus status = EndpointStatus.fromValue(statusNode.asText());
        if (status == null) {
            throw new CalicoRuntimeException(
                    String.format("Unknown endpoint status '%s'.", statusNode.asText()));
        }
        return status;
    }
}

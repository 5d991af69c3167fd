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

package org.projectcalico.utils.json;

import org.projectcalico.annotation.Internal;
import org.projectcalico.exception.CalicoRuntimeException;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/** A utility class that provide abilities for JSON serialization and deserialization. */
@Internal
public class JsonSerdeUtils {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * Serializes the given object to UTF-8 encoded JSON bytes.
     *
     * @throws CalicoRuntimeException if the object could not be written
     */
    public static <T> byte[] writeValueAsBytes(T value, JsonSerializer<T> serializer) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator generator =
                OBJECT_MAPPER.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
            serializer.serialize(value, generator);
        } catch (IOException e) {
            throw new CalicoRuntimeException(
                    String.format("Failed to serialize %s to JSON.", value), e);
        }
        return out.toByteArray();
    }

    /**
     * Deserializes the given JSON bytes into an object.
     *
     * @throws CalicoRuntimeException if the bytes are not valid JSON or do not describe the
     *     expected object
     */
    public static <T> T readValue(byte[] json, JsonDeserializer<T> deserializer) {
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(json);
        } catch (IOException e) {
            throw new CalicoRuntimeException("Failed to parse JSON value.", e);
        }
        if (node == null || node.isMissingNode()) {
            throw new CalicoRuntimeException("Failed to parse JSON value: empty input.");
        }
        return deserializer.deserialize(node);
    }

    private JsonSerdeUtils() {}
}

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

import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;

/**
 * Json serializer for the values stored under data model keys.
 *
 * @param <T> the type of the object to serialize
 */
@Internal
public interface JsonSerializer<T> {

    /** Serializes the given object to a JSON value using the given generator. */
    void serialize(T t, JsonGenerator generator) throws IOException;
}

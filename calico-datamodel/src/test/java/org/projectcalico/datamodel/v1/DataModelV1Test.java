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

import org.projectcalico.datamodel.v1.DataModelV1.ConfigKey;
import org.projectcalico.datamodel.v1.DataModelV1.EndpointKey;
import org.projectcalico.datamodel.v1.DataModelV1.EndpointStatusKey;
import org.projectcalico.datamodel.v1.DataModelV1.FelixStatusDir;
import org.projectcalico.datamodel.v1.DataModelV1.HostConfigDir;
import org.projectcalico.datamodel.v1.DataModelV1.HostDir;
import org.projectcalico.datamodel.v1.DataModelV1.HostIpKey;
import org.projectcalico.datamodel.v1.DataModelV1.IpamV4PoolKey;
import org.projectcalico.datamodel.v1.DataModelV1.LastStatusKey;
import org.projectcalico.datamodel.v1.DataModelV1.NeutronElectionKey;
import org.projectcalico.datamodel.v1.DataModelV1.ProfileDir;
import org.projectcalico.datamodel.v1.DataModelV1.ProfileRulesKey;
import org.projectcalico.datamodel.v1.DataModelV1.ProfileTagsKey;
import org.projectcalico.datamodel.v1.DataModelV1.ReadyKey;
import org.projectcalico.datamodel.v1.DataModelV1.StatusKey;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link DataModelV1}. */
class DataModelV1Test {

    private static final String ENDPOINT_KEY =
            "/calico/v1/host/h1/workload/orc/w1/endpoint/e1";
    private static final String ENDPOINT_STATUS_KEY =
            "/calico/felix/v1/host/h1/workload/orc/w1/endpoint/e1";

    @Test
    void testDirectories() {
        assertThat(DataModelV1.ROOT_DIR).isEqualTo("/calico");
        assertThat(DataModelV1.VERSION_DIR).isEqualTo("/calico/v1");
        assertThat(DataModelV1.OPENSTACK_DIR).isEqualTo("/calico/openstack");
        assertThat(DataModelV1.OPENSTACK_VERSION_DIR).isEqualTo("/calico/openstack/v1");
        assertThat(DataModelV1.FELIX_STATUS_DIR).isEqualTo("/calico/felix/v1/host");
        assertThat(DataModelV1.CONFIG_DIR).isEqualTo("/calico/v1/config");
        assertThat(DataModelV1.HOST_DIR).isEqualTo("/calico/v1/host");
        assertThat(DataModelV1.POLICY_DIR).isEqualTo("/calico/v1/policy");
        assertThat(DataModelV1.PROFILE_DIR).isEqualTo("/calico/v1/policy/profile");
        assertThat(ReadyKey.path()).isEqualTo("/calico/v1/Ready");
        assertThat(NeutronElectionKey.path()).isEqualTo("/calico/openstack/v1/neutron_election");
    }

    @Test
    void testBuildKeys() {
        assertThat(HostDir.path("h1")).isEqualTo("/calico/v1/host/h1");
        assertThat(HostConfigDir.path("h1")).isEqualTo("/calico/v1/host/h1/config");
        assertThat(HostIpKey.path("h1")).isEqualTo("/calico/v1/host/h1/bird_ip");
        assertThat(FelixStatusDir.path("h1")).isEqualTo("/calico/felix/v1/host/h1");
        assertThat(StatusKey.path("h1")).isEqualTo("/calico/felix/v1/host/h1/status");
        assertThat(LastStatusKey.path("h1"))
                .isEqualTo("/calico/felix/v1/host/h1/last_reported_status");
        assertThat(EndpointKey.path("h1", "orc", "w1", "e1")).isEqualTo(ENDPOINT_KEY);
        assertThat(EndpointStatusKey.path("h1", "orc", "w1", "e1"))
                .isEqualTo(ENDPOINT_STATUS_KEY);
        assertThat(ProfileDir.path("prof")).isEqualTo("/calico/v1/policy/profile/prof");
        assertThat(ProfileRulesKey.path("prof"))
                .isEqualTo("/calico/v1/policy/profile/prof/rules");
        assertThat(ProfileTagsKey.path("prof")).isEqualTo("/calico/v1/policy/profile/prof/tags");
        assertThat(ConfigKey.path("LogSeverityFile"))
                .isEqualTo("/calico/v1/config/LogSeverityFile");
        assertThat(IpamV4PoolKey.path("10.65.0.0-16"))
                .isEqualTo("/calico/v1/ipam/v4/pool/10.65.0.0-16");
    }

    @Test
    void testRoundTrip() {
        assertThat(HostDir.parsePath(HostDir.path("host-a"))).isEqualTo("host-a");
        assertThat(HostIpKey.parsePath(HostIpKey.path("host-a"))).isEqualTo("host-a");
        assertThat(HostConfigDir.parseHostname(HostConfigDir.path("host-a"))).isEqualTo("host-a");
        assertThat(ConfigKey.parsePath(ConfigKey.path("InterfacePrefix")))
                .isEqualTo("InterfacePrefix");
        assertThat(ProfileDir.parsePath(ProfileDir.path("prof-1"))).isEqualTo("prof-1");
        assertThat(ProfileRulesKey.parsePath(ProfileRulesKey.path("prof-1"))).isEqualTo("prof-1");
        assertThat(ProfileTagsKey.parsePath(ProfileTagsKey.path("prof-1"))).isEqualTo("prof-1");
        assertThat(IpamV4PoolKey.parsePath(IpamV4PoolKey.path("192.168.0.0-24")))
                .isEqualTo("192.168.0.0-24");
        assertThat(StatusKey.parseHostname(StatusKey.path("host-a"))).isEqualTo("host-a");
        assertThat(LastStatusKey.parseHostname(LastStatusKey.path("host-a"))).isEqualTo("host-a");

        EndpointId id = new EndpointId("host-a", "openstack", "vm-7", "tap1234");
        assertThat(EndpointKey.parsePath(EndpointKey.path(id))).isEqualTo(id);
        assertThat(EndpointKey.parsePath(EndpointStatusKey.path(id))).isEqualTo(id);
    }

    @Test
    void testParseEndpointKey() {
        EndpointId expected = new EndpointId("h1", "orc", "w1", "e1");
        assertThat(EndpointKey.parsePath(ENDPOINT_KEY)).isEqualTo(expected);
        assertThat(EndpointKey.parsePath(ENDPOINT_STATUS_KEY)).isEqualTo(expected);

        // keys below an endpoint still belong to it
        assertThat(EndpointKey.parsePath(ENDPOINT_STATUS_KEY + "/status")).isEqualTo(expected);

        // invalid keys
        assertThat(EndpointKey.parsePath("/calico/v1/host/h1/workload/orc/w1/endpoint"))
                .isNull();
        assertThat(EndpointKey.parsePath("/calico/v1/host/h1/workload/orc/w1/endpoint/"))
                .isNull();
        assertThat(EndpointKey.parsePath("/calico/v1/host/h1/workload/orc/endpoint/e1")).isNull();
        assertThat(EndpointKey.parsePath("/calico/v1/host//workload/orc/w1/endpoint/e1"))
                .isNull();
        assertThat(EndpointKey.parsePath("/calico/v2/host/h1/workload/orc/w1/endpoint/e1"))
                .isNull();
        assertThat(EndpointKey.parsePath("/prefix" + ENDPOINT_KEY)).isNull();
    }

    @Test
    void testParseProfileKeys() {
        assertThat(ProfileDir.parsePath("/calico/v1/policy/profile/foo")).isEqualTo("foo");
        assertThat(ProfileDir.parsePath("/calico/v1/policy/profile/foo/")).isEqualTo("foo");
        assertThat(ProfileDir.parsePath("/calico/v1/policy/profile/foo//")).isEqualTo("foo");
        assertThat(ProfileDir.parsePath("/calico/v1/policy/profile/foo/rules")).isNull();
        assertThat(ProfileDir.parsePath("/calico/v1/policy/profile")).isNull();
        assertThat(ProfileDir.parsePath("/calico/v1/policy/profile/")).isNull();
        assertThat(ProfileDir.parsePath("foo")).isNull();

        assertThat(ProfileRulesKey.parsePath("/calico/v1/policy/profile/foo/rules"))
                .isEqualTo("foo");
        assertThat(ProfileRulesKey.parsePath("/calico/v1/policy/profile/foo/tags")).isNull();
        assertThat(ProfileRulesKey.parsePath("/calico/v1/policy/profile/foo/rulesX")).isNull();
        assertThat(ProfileRulesKey.parsePath("/calico/v1/policy/profile/a/b/rules")).isNull();

        assertThat(ProfileTagsKey.parsePath("/calico/v1/policy/profile/foo/tags"))
                .isEqualTo("foo");
        assertThat(ProfileTagsKey.parsePath("/calico/v1/policy/profile/foo/rules")).isNull();
        assertThat(ProfileTagsKey.parsePath("/calico/v1/policy/profile//tags")).isNull();
    }

    @Test
    void testParseHostKeys() {
        assertThat(HostDir.parsePath("/calico/v1/host/h1/")).isEqualTo("h1");
        assertThat(HostDir.parsePath("/calico/v1/host/h1/bird_ip")).isNull();
        assertThat(HostIpKey.parsePath("/calico/v1/host/h1/bird_ip")).isEqualTo("h1");
        assertThat(HostIpKey.parsePath("/calico/v1/host/h1/bird_ip6")).isNull();
        assertThat(HostIpKey.parsePath("/calico/felix/v1/host/h1/bird_ip")).isNull();
        assertThat(HostConfigDir.parseHostname("/calico/v1/host/h1/config/LogSeverity"))
                .isEqualTo("h1");
        assertThat(HostConfigDir.parseHostname("/calico/v1/host/h1/configuration")).isNull();
        assertThat(ConfigKey.parsePath("/calico/v1/config/")).isNull();
        assertThat(ConfigKey.parsePath("/calico/v1/config/a/b")).isNull();
        assertThat(IpamV4PoolKey.parsePath("/calico/v1/ipam/v4/pool/")).isNull();
        assertThat(IpamV4PoolKey.parsePath("/calico/v1/ipam/v6/pool/fd80::-64")).isNull();
    }

    @Test
    void testParseHostnameFromStatusKey() {
        assertThat(StatusKey.parseHostname(ENDPOINT_STATUS_KEY + "/status")).isEqualTo("h1");
        assertThat(StatusKey.parseHostname("/calico/felix/v1/host/h1/status")).isEqualTo("h1");

        // missing suffix
        assertThat(StatusKey.parseHostname(ENDPOINT_STATUS_KEY)).isNull();
        assertThat(StatusKey.parseHostname("/calico/felix/v1/host/h1/last_reported_status"))
                .isNull();
        // not under the status root
        assertThat(StatusKey.parseHostname(ENDPOINT_KEY + "/status")).isNull();
        assertThat(StatusKey.parseHostname("/calico/felix/v1/hostx/h1/status")).isNull();
        // no hostname
        assertThat(StatusKey.parseHostname("/calico/felix/v1/host/status")).isNull();
        assertThat(StatusKey.parseHostname("/calico/felix/v1/host//status")).isNull();
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "",
                "/",
                "/foo/bar",
                "/calico",
                "/calico/v2/host/h1/workload/orc/w1/endpoint/e1",
                "/calico/v2/policy/profile/foo/rules",
                "/calico/v2/ipam/v4/pool/10.0.0.0-8",
                "\u0000\u00ff/calico\u0007"
            })
    void testUnrelatedKeysAreNotMatched(String key) {
        Stream<Function<String, Object>> matchers =
                Stream.of(
                        ProfileRulesKey::parsePath,
                        ProfileTagsKey::parsePath,
                        ProfileDir::parsePath,
                        EndpointKey::parsePath,
                        HostIpKey::parsePath,
                        HostDir::parsePath,
                        HostConfigDir::parseHostname,
                        ConfigKey::parsePath,
                        IpamV4PoolKey::parsePath,
                        StatusKey::parseHostname,
                        LastStatusKey::parseHostname);
        matchers.forEach(matcher -> assertThat(matcher.apply(key)).isNull());
        assertThat(DataModelV1.classify(key)).isEqualTo(KeyType.UNKNOWN);
    }

    @Test
    void testClassify() {
        assertThat(DataModelV1.classify("/calico/v1/Ready")).isEqualTo(KeyType.READY);
        assertThat(DataModelV1.classify("/calico/v1/config/LogSeverityFile"))
                .isEqualTo(KeyType.CONFIG);
        assertThat(DataModelV1.classify("/calico/v1/host/h1")).isEqualTo(KeyType.HOST);
        assertThat(DataModelV1.classify("/calico/v1/host/h1/config/LogSeverityFile"))
                .isEqualTo(KeyType.HOST_CONFIG);
        assertThat(DataModelV1.classify("/calico/v1/host/h1/bird_ip"))
                .isEqualTo(KeyType.HOST_IP);
        assertThat(DataModelV1.classify(ENDPOINT_KEY)).isEqualTo(KeyType.ENDPOINT);
        assertThat(DataModelV1.classify(ENDPOINT_STATUS_KEY))
                .isEqualTo(KeyType.ENDPOINT_STATUS);
        assertThat(DataModelV1.classify("/calico/felix/v1/host/h1/status"))
                .isEqualTo(KeyType.FELIX_STATUS);
        assertThat(DataModelV1.classify("/calico/v1/policy/profile/foo/"))
                .isEqualTo(KeyType.PROFILE);
        assertThat(DataModelV1.classify("/calico/v1/policy/profile/foo/rules"))
                .isEqualTo(KeyType.PROFILE_RULES);
        assertThat(DataModelV1.classify("/calico/v1/policy/profile/foo/tags"))
                .isEqualTo(KeyType.PROFILE_TAGS);
        assertThat(DataModelV1.classify("/calico/v1/ipam/v4/pool/10.65.0.0-16"))
                .isEqualTo(KeyType.IPAM_V4_POOL);
        assertThat(DataModelV1.classify("/calico/openstack/v1/neutron_election"))
                .isEqualTo(KeyType.NEUTRON_ELECTION);
        assertThat(DataModelV1.classify("/calico/felix/v1/host/h1/last_reported_status"))
                .isEqualTo(KeyType.FELIX_LAST_STATUS);
        assertThat(DataModelV1.classify("/calico/felix/v1/host/h1")).isEqualTo(KeyType.UNKNOWN);
    }

    @Test
    void testClassifyPrefersEndpointStatusOverHostStatus() {
        String key = "/calico/felix/v1/host/h1/workload/o/w/endpoint/e1/status";
        assertThat(StatusKey.parseHostname(key)).isEqualTo("h1");
        assertThat(EndpointKey.parsePath(key))
                .isEqualTo(new EndpointId("h1", "o", "w", "e1"));
        assertThat(DataModelV1.classify(key)).isEqualTo(KeyType.ENDPOINT_STATUS);
    }

    @Test
    void testReadyFlag() {
        assertThat(new String(ReadyKey.encode(true), StandardCharsets.UTF_8)).isEqualTo("true");
        assertThat(ReadyKey.decode(ReadyKey.encode(true))).isTrue();
        assertThat(ReadyKey.decode(ReadyKey.encode(false))).isFalse();
        assertThat(ReadyKey.decode("true\n".getBytes(StandardCharsets.UTF_8))).isTrue();
        assertThat(ReadyKey.decode("yes".getBytes(StandardCharsets.UTF_8))).isFalse();
    }
}

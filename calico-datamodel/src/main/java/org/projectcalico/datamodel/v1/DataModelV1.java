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
import org.projectcalico.utils.json.JsonSerdeUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.projectcalico.utils.Preconditions.checkNotNull;

/**
 * The keys stored in etcd for version 1 of the Calico data model, together with the codecs
 * between keys and the identifiers embedded in them.
 *
 * <p>Only back-compatible changes may be made to this class. An incompatible layout goes into a
 * new class with a revved version suffix, so that several versions of the data model can be
 * served side by side during a migration.
 *
 * <p>The {@code path(..)} methods never validate their arguments: identifiers must be non-empty
 * and must not contain '/'. The {@code parse..(..)} methods accept any non-null key and return
 * null when the key does not have the expected shape; such keys are simply not of interest to the
 * caller.
 *
 * @since 0.1
 */
@PublicEvolving
public final class DataModelV1 {

    private static final Logger LOG = LoggerFactory.getLogger(DataModelV1.class);

    /** All Calico data is stored under this path. */
    public static final String ROOT_DIR = "/calico";

    public static final String FELIX_VERSION = "/v1";
    public static final String OPENSTACK_VERSION = "/v1";

    /** OpenStack data is stored under this path. */
    public static final String OPENSTACK_DIR = ROOT_DIR + "/openstack";

    public static final String OPENSTACK_VERSION_DIR = OPENSTACK_DIR + OPENSTACK_VERSION;

    /** Status data reported by Felix, per host. */
    public static final String FELIX_STATUS_DIR = ROOT_DIR + "/felix" + FELIX_VERSION + "/host";

    /** Data that flows from the orchestrator to Felix is stored under a versioned sub-tree. */
    public static final String VERSION_DIR = ROOT_DIR + FELIX_VERSION;

    /** Global ready flag. Stores 'true' or 'false'. */
    public static final String READY_KEY = VERSION_DIR + "/Ready";

    public static final String CONFIG_DIR = VERSION_DIR + "/config";
    public static final String HOST_DIR = VERSION_DIR + "/host";
    public static final String POLICY_DIR = VERSION_DIR + "/policy";
    public static final String PROFILE_DIR = POLICY_DIR + "/profile";
    public static final String IPAM_V4_POOL_DIR = VERSION_DIR + "/ipam/v4/pool";

    /** Key used for leader election by the Neutron mechanism drivers. */
    public static final String NEUTRON_ELECTION_KEY = OPENSTACK_VERSION_DIR + "/neutron_election";

    // a captured identifier, which is one non-empty path segment
    private static final String SEGMENT = "([^/]+)";

    // the previous segment must end at a segment boundary
    private static final String SEGMENT_END = "(?=/|$)";

    // ------------------------------------------------------------------------------------------
    // Keys under "/calico/v1/"
    // ------------------------------------------------------------------------------------------

    /**
     * The global ready flag. The key is:
     *
     * <p>/calico/v1/Ready
     */
    public static final class ReadyKey {
        public static String path() {
            return READY_KEY;
        }

        public static byte[] encode(boolean ready) {
            return String.valueOf(ready).getBytes(StandardCharsets.UTF_8);
        }

        /** Anything other than "true" means the data model is not ready. */
        public static boolean decode(byte[] value) {
            return "true".equals(new String(value, StandardCharsets.UTF_8).trim());
        }
    }

    /**
     * The directory of the global configuration. The key is:
     *
     * <p>/calico/v1/config
     */
    public static final class ConfigDir {
        public static String path() {
            return CONFIG_DIR;
        }
    }

    /**
     * A global configuration value. The key is:
     *
     * <p>/calico/v1/config/[configName]
     */
    public static final class ConfigKey {
        public static String path(String configName) {
            return ConfigDir.path() + "/" + configName;
        }

        /**
         * Extracts the config name from the given key. If the given key is not a {@link ConfigKey}
         * key, returns null.
         */
        @Nullable
        public static String parsePath(String key) {
            String prefix = ConfigDir.path() + "/";
            if (!key.startsWith(prefix)) {
                return null;
            }
            String configName = key.substring(prefix.length());
            if (configName.isEmpty() || configName.indexOf('/') >= 0) {
                return null;
            }
            return configName;
        }
    }

    /**
     * The directory of all the data of a host. The key is:
     *
     * <p>/calico/v1/host/[hostname]
     */
    public static final class HostDir {
        public static String path(String hostname) {
            return HOST_DIR + "/" + hostname;
        }

        /**
         * Extracts the hostname from the given host directory key, a trailing slash is ignored.
         * Returns null for any other key, including the keys below the host directory.
         */
        @Nullable
        public static String parsePath(String key) {
            return childOf(HOST_DIR, key);
        }
    }

    /**
     * The directory of the per-host configuration. The key is:
     *
     * <p>/calico/v1/host/[hostname]/config
     */
    public static final class HostConfigDir {
        private static final Pattern HOST_CONFIG_KEY_RE =
                Pattern.compile(
                        "^"
                                + Pattern.quote(HOST_DIR)
                                + "/"
                                + SEGMENT
                                + "/config"
                                + SEGMENT_END);

        public static String path(String hostname) {
            return HostDir.path(hostname) + "/config";
        }

        /**
         * Extracts the hostname from the per-host configuration directory or from any key below
         * it. Returns null if the given key is not in a per-host configuration directory.
         */
        @Nullable
        public static String parseHostname(String key) {
            Matcher matcher = HOST_CONFIG_KEY_RE.matcher(key);
            return matcher.lookingAt() ? matcher.group(1) : null;
        }
    }

    /**
     * The BIRD IP address of a host. The key is:
     *
     * <p>/calico/v1/host/[hostname]/bird_ip
     */
    public static final class HostIpKey {
        private static final Pattern HOST_IP_KEY_RE =
                Pattern.compile(
                        "^"
                                + Pattern.quote(HOST_DIR)
                                + "/"
                                + SEGMENT
                                + "/bird_ip"
                                + SEGMENT_END);

        public static String path(String hostname) {
            return HostDir.path(hostname) + "/bird_ip";
        }

        /** Extracts the hostname from the given key, or returns null if it is not a host IP key. */
        @Nullable
        public static String parsePath(String key) {
            Matcher matcher = HOST_IP_KEY_RE.matcher(key);
            return matcher.lookingAt() ? matcher.group(1) : null;
        }
    }

    /**
     * The configuration of an endpoint. The key is:
     *
     * <p>/calico/v1/host/[hostname]/workload/[orchestrator]/[workloadId]/endpoint/[endpointId]
     *
     * <p>The status of the endpoint lives at the same relative path under the Felix status
     * directory, see {@link EndpointStatusKey}.
     */
    public static final class EndpointKey {
        private static final Pattern ENDPOINT_KEY_RE =
                Pattern.compile(
                        "^(?:"
                                + Pattern.quote(HOST_DIR)
                                + "|"
                                + Pattern.quote(FELIX_STATUS_DIR)
                                + ")"
                                + "/(?<hostname>[^/]+)"
                                + "/workload"
                                + "/(?<orchestrator>[^/]+)"
                                + "/(?<workloadId>[^/]+)"
                                + "/endpoint"
                                + "/(?<endpointId>[^/]+)");

        public static String path(
                String hostname, String orchestrator, String workloadId, String endpointId) {
            return endpointPath(HOST_DIR, hostname, orchestrator, workloadId, endpointId);
        }

        public static String path(EndpointId endpointId) {
            return path(
                    endpointId.getHost(),
                    endpointId.getOrchestrator(),
                    endpointId.getWorkload(),
                    endpointId.getEndpoint());
        }

        /**
         * Extracts the {@link EndpointId} from an endpoint configuration key or an endpoint status
         * key. Returns null if the key is neither. The components of the id are used as they are
         * found in the key.
         */
        @Nullable
        public static EndpointId parsePath(String key) {
            return parsePath(key, EndpointIdFactory.withoutInterning());
        }

        /**
         * Same as {@link #parsePath(String)}, the id is created by the given factory so that its
         * components are canonicalized.
         */
        @Nullable
        public static EndpointId parsePath(String key, EndpointIdFactory factory) {
            Matcher matcher = ENDPOINT_KEY_RE.matcher(key);
            if (!matcher.lookingAt()) {
                return null;
            }
            return factory.create(
                    matcher.group("hostname"),
                    matcher.group("orchestrator"),
                    matcher.group("workloadId"),
                    matcher.group("endpointId"));
        }
    }

    // ------------------------------------------------------------------------------------------
    // Keys under "/calico/v1/policy/"
    // ------------------------------------------------------------------------------------------

    /**
     * The directory of a profile. The key is:
     *
     * <p>/calico/v1/policy/profile/[profileId]
     */
    public static final class ProfileDir {
        public static String path(String profileId) {
            return PROFILE_DIR + "/" + profileId;
        }

        /**
         * Returns the profile id if the given key is a profile directory, or null if it is not.
         * Trailing slashes are ignored, so "/calico/v1/policy/profile/foo/" is the directory of
         * profile "foo" while "/calico/v1/policy/profile/foo/rules" is not a profile directory.
         */
        @Nullable
        public static String parsePath(String key) {
            return childOf(PROFILE_DIR, key);
        }
    }

    /**
     * The rules of a profile. The key is:
     *
     * <p>/calico/v1/policy/profile/[profileId]/rules
     */
    public static final class ProfileRulesKey {
        private static final Pattern RULES_KEY_RE =
                Pattern.compile(
                        "^"
                                + Pattern.quote(PROFILE_DIR)
                                + "/"
                                + SEGMENT
                                + "/rules"
                                + SEGMENT_END);

        public static String path(String profileId) {
            return ProfileDir.path(profileId) + "/rules";
        }

        /** Extracts the profile id, or returns null if the key is not a profile rules key. */
        @Nullable
        public static String parsePath(String key) {
            Matcher matcher = RULES_KEY_RE.matcher(key);
            return matcher.lookingAt() ? matcher.group(1) : null;
        }
    }

    /**
     * The tags of a profile. The key is:
     *
     * <p>/calico/v1/policy/profile/[profileId]/tags
     */
    public static final class ProfileTagsKey {
        private static final Pattern TAGS_KEY_RE =
                Pattern.compile(
                        "^"
                                + Pattern.quote(PROFILE_DIR)
                                + "/"
                                + SEGMENT
                                + "/tags"
                                + SEGMENT_END);

        public static String path(String profileId) {
            return ProfileDir.path(profileId) + "/tags";
        }

        /** Extracts the profile id, or returns null if the key is not a profile tags key. */
        @Nullable
        public static String parsePath(String key) {
            Matcher matcher = TAGS_KEY_RE.matcher(key);
            return matcher.lookingAt() ? matcher.group(1) : null;
        }
    }

    // ------------------------------------------------------------------------------------------
    // Keys under "/calico/v1/ipam/"
    // ------------------------------------------------------------------------------------------

    /**
     * An IPv4 pool. The CIDR is stored in its encoded form, e.g. "10.65.0.0-16". The key is:
     *
     * <p>/calico/v1/ipam/v4/pool/[encodedCidr]
     */
    public static final class IpamV4PoolKey {
        private static final Pattern IPAM_V4_CIDR_KEY_RE =
                Pattern.compile("^" + Pattern.quote(IPAM_V4_POOL_DIR) + "/" + SEGMENT);

        public static String path(String encodedCidr) {
            return IPAM_V4_POOL_DIR + "/" + encodedCidr;
        }

        /** Extracts the encoded CIDR, or returns null if the key is not an IPv4 pool key. */
        @Nullable
        public static String parsePath(String key) {
            Matcher matcher = IPAM_V4_CIDR_KEY_RE.matcher(key);
            return matcher.lookingAt() ? matcher.group(1) : null;
        }
    }

    // ------------------------------------------------------------------------------------------
    // Keys under "/calico/felix/v1/host/"
    // ------------------------------------------------------------------------------------------

    /**
     * The directory of the status reported by the Felix of a host. The key is:
     *
     * <p>/calico/felix/v1/host/[hostname]
     */
    public static final class FelixStatusDir {
        public static String path(String hostname) {
            return FELIX_STATUS_DIR + "/" + hostname;
        }
    }

    /**
     * The status of the Felix of a host. The key is:
     *
     * <p>/calico/felix/v1/host/[hostname]/status
     */
    public static final class StatusKey {
        private static final String STATUS_SUFFIX = "/status";

        public static String path(String hostname) {
            return FelixStatusDir.path(hostname) + STATUS_SUFFIX;
        }

        /**
         * Gets the hostname from any status key under {@link DataModelV1#FELIX_STATUS_DIR}, that
         * is a key of the form /calico/felix/v1/host/[hostname]/.../status. This accepts more keys
         * than {@link EndpointKey#parsePath(String)}, it is meant for callers that only need the
         * owning host. Returns null if the key is not a status key.
         */
        @Nullable
        public static String parseHostname(String key) {
            String prefix = FELIX_STATUS_DIR + "/";
            if (!key.startsWith(prefix) || !key.endsWith(STATUS_SUFFIX)) {
                return null;
            }
            String inHostDir = key.substring(prefix.length());
            int slash = inHostDir.indexOf('/');
            // no hostname segment before the suffix
            if (slash <= 0) {
                return null;
            }
            return inHostDir.substring(0, slash);
        }
    }

    /**
     * The last status reported by the Felix of a host. The key is:
     *
     * <p>/calico/felix/v1/host/[hostname]/last_reported_status
     */
    public static final class LastStatusKey {
        private static final Pattern LAST_STATUS_KEY_RE =
                Pattern.compile(
                        "^"
                                + Pattern.quote(FELIX_STATUS_DIR)
                                + "/"
                                + SEGMENT
                                + "/last_reported_status$");

        public static String path(String hostname) {
            return FelixStatusDir.path(hostname) + "/last_reported_status";
        }

        /** Extracts the hostname, or returns null if the key is not a last status key. */
        @Nullable
        public static String parseHostname(String key) {
            Matcher matcher = LAST_STATUS_KEY_RE.matcher(key);
            return matcher.matches() ? matcher.group(1) : null;
        }
    }

    /**
     * The status of an endpoint as reported by Felix. The key is:
     *
     * <p>/calico/felix/v1/host/[hostname]/workload/[orchestrator]/[workloadId]/endpoint/[endpointId]
     *
     * <p>Endpoint status keys are parsed by {@link EndpointKey#parsePath(String)}.
     */
    public static final class EndpointStatusKey {
        public static String path(
                String hostname, String orchestrator, String workloadId, String endpointId) {
            return endpointPath(FELIX_STATUS_DIR, hostname, orchestrator, workloadId, endpointId);
        }

        public static String path(EndpointId endpointId) {
            return endpointId.pathForStatus();
        }

        public static byte[] encode(EndpointStatus status) {
            return JsonSerdeUtils.writeValueAsBytes(
                    checkNotNull(status), EndpointStatusJsonSerde.INSTANCE);
        }

        public static EndpointStatus decode(byte[] json) {
            return JsonSerdeUtils.readValue(json, EndpointStatusJsonSerde.INSTANCE);
        }
    }

    // ------------------------------------------------------------------------------------------
    // Keys under "/calico/openstack/v1/"
    // ------------------------------------------------------------------------------------------

    /**
     * The key used for the leader election of the Neutron mechanism drivers. The key is:
     *
     * <p>/calico/openstack/v1/neutron_election
     */
    public static final class NeutronElectionKey {
        public static String path() {
            return NEUTRON_ELECTION_KEY;
        }
    }

    // ------------------------------------------------------------------------------------------

    /**
     * Classifies the given key. Keys that belong to no known shape, for instance keys of another
     * version of the data model, are {@link KeyType#UNKNOWN} and should be ignored.
     *
     * <p>A key matching several shapes gets the most specific one. Endpoint keys win over host
     * keys, so the endpoint status key
     * {@code /calico/felix/v1/host/h1/workload/o/w/endpoint/e1/status} is an {@link
     * KeyType#ENDPOINT_STATUS} although {@link StatusKey#parseHostname} also accepts it.
     */
    public static KeyType classify(String key) {
        if (READY_KEY.equals(key)) {
            return KeyType.READY;
        } else if (NEUTRON_ELECTION_KEY.equals(key)) {
            return KeyType.NEUTRON_ELECTION;
        } else if (ProfileRulesKey.parsePath(key) != null) {
            return KeyType.PROFILE_RULES;
        } else if (ProfileTagsKey.parsePath(key) != null) {
            return KeyType.PROFILE_TAGS;
        } else if (ProfileDir.parsePath(key) != null) {
            return KeyType.PROFILE;
        } else if (EndpointKey.parsePath(key) != null) {
            return key.startsWith(HOST_DIR + "/") ? KeyType.ENDPOINT : KeyType.ENDPOINT_STATUS;
        } else if (HostDir.parsePath(key) != null) {
            return KeyType.HOST;
        } else if (HostIpKey.parsePath(key) != null) {
            return KeyType.HOST_IP;
        } else if (HostConfigDir.parseHostname(key) != null) {
            return KeyType.HOST_CONFIG;
        } else if (ConfigKey.parsePath(key) != null) {
            return KeyType.CONFIG;
        } else if (IpamV4PoolKey.parsePath(key) != null) {
            return KeyType.IPAM_V4_POOL;
        } else if (StatusKey.parseHostname(key) != null) {
            return KeyType.FELIX_STATUS;
        } else if (LastStatusKey.parseHostname(key) != null) {
            return KeyType.FELIX_LAST_STATUS;
        }
        LOG.debug("Ignoring key {} which is not part of data model {}.", key, FELIX_VERSION);
        return KeyType.UNKNOWN;
    }

    private static String endpointPath(
            String rootDir,
            String hostname,
            String orchestrator,
            String workloadId,
            String endpointId) {
        return rootDir
                + "/"
                + hostname
                + "/workload/"
                + orchestrator
                + "/"
                + workloadId
                + "/endpoint/"
                + endpointId;
    }

    /**
     * Returns the last segment of the given key if its parent is exactly the given directory,
     * trailing slashes of the key are ignored.
     */
    @Nullable
    private static String childOf(String parentDir, String key) {
        int end = key.length();
        while (end > 0 && key.charAt(end - 1) == '/') {
            end--;
        }
        String trimmed = key.substring(0, end);
        int lastSlash = trimmed.lastIndexOf('/');
        if (lastSlash < 0) {
            return null;
        }
        String parent = trimmed.substring(0, lastSlash);
        return parent.equals(parentDir) ? trimmed.substring(lastSlash + 1) : null;
    }

    private DataModelV1() {}
}

// Copyright (c) 2026 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.client.supervisor.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.client.supervisor.SupervisorException;
import com.rabbitmq.client.supervisor.transport.TlsConfiguration;
import org.junit.jupiter.api.Test;

public class TlsUtilsTest {

  @Test
  void enabledProtocolsShouldKeepOnlyTls12AndNewer() {
    assertThat(
            TlsUtils.enabledProtocols(new String[] {"TLSv1", "TLSv1.1", "TLSv1.2", "TLSv1.3"}))
        .containsExactly("TLSv1.3", "TLSv1.2");
    assertThat(TlsUtils.enabledProtocols(new String[] {"SSLv3", "TLSv1.2"}))
        .containsExactly("TLSv1.2");
  }

  @Test
  void enabledProtocolsShouldFailWhenOnlyLegacyProtocolsAreSupported() {
    assertThatThrownBy(() -> TlsUtils.enabledProtocols(new String[] {"TLSv1", "TLSv1.1"}))
        .isInstanceOf(SupervisorException.SupervisorConfigurationException.class)
        .hasMessageContaining("TLSv1.2");
  }

  @Test
  void defaultTlsConfigurationShouldVerifyHostnameWithTls12Minimum() {
    TlsConfiguration configuration = TlsUtils.defaultTlsConfiguration();
    assertThat(configuration.sslContext()).isNotNull();
    assertThat(configuration.hostnameVerification()).isTrue();
    assertThat(configuration.protocols()).isNotEmpty().isSubsetOf("TLSv1.3", "TLSv1.2");
  }
}

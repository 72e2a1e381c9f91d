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
package com.rabbitmq.client.supervisor.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Message handed to {@link TransportChannel#publish}. */
public final class OutboundMessage {

  private final Map<String, Object> headers;
  private final String contentType;
  private final byte[] body;

  public OutboundMessage(Map<String, Object> headers, String contentType, byte[] body) {
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    this.contentType = contentType;
    this.body = body;
  }

  public Map<String, Object> headers() {
    return this.headers;
  }

  public String contentType() {
    return this.contentType;
  }

  public byte[] body() {
    return this.body;
  }
}

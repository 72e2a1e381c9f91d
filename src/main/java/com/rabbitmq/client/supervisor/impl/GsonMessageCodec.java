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

import com.google.gson.Gson;
import com.rabbitmq.client.supervisor.MessageCodec;
import java.nio.charset.StandardCharsets;

/**
 * {@link MessageCodec} using <a href="https://github.com/google/gson">Gson</a>.
 *
 * <p>The default instance does not serialize null fields and rejects NaN and infinite numbers.
 */
public class GsonMessageCodec implements MessageCodec {

  private static final Gson GSON = new Gson();

  private final Gson gson;

  public GsonMessageCodec() {
    this(GSON);
  }

  public GsonMessageCodec(Gson gson) {
    this.gson = gson;
  }

  @Override
  public byte[] encode(Object payload) {
    return this.gson.toJson(payload).getBytes(StandardCharsets.UTF_8);
  }
}

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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.SocketConfigurators;
import com.rabbitmq.client.supervisor.transport.CloseListener;
import com.rabbitmq.client.supervisor.transport.CloseNotification;
import com.rabbitmq.client.supervisor.transport.OutboundMessage;
import com.rabbitmq.client.supervisor.transport.TlsConfiguration;
import com.rabbitmq.client.supervisor.transport.Transport;
import com.rabbitmq.client.supervisor.transport.TransportChannel;
import com.rabbitmq.client.supervisor.transport.TransportConnection;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import javax.net.ssl.SSLSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} on top of the <a href="https://www.rabbitmq.com/client-libraries/java-api-guide">
 * RabbitMQ Java client</a> (AMQP 0-9-1).
 *
 * <p>Automatic recovery of the client library is disabled.
 */
public class AmqpClientTransport implements Transport {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpClientTransport.class);

  private final Supplier<ConnectionFactory> connectionFactorySupplier;

  public AmqpClientTransport() {
    this(ConnectionFactory::new);
  }

  /**
   * Transport with a custom connection factory.
   *
   * <p>The supplier is called for each connection. Recovery settings of the factory are
   * overridden.
   *
   * @param connectionFactorySupplier connection factory supplier
   */
  public AmqpClientTransport(Supplier<ConnectionFactory> connectionFactorySupplier) {
    this.connectionFactorySupplier = connectionFactorySupplier;
  }

  @Override
  public TransportConnection dial(URI uri, TlsConfiguration tls, String connectionName)
      throws IOException {
    ConnectionFactory factory = this.connectionFactorySupplier.get();
    try {
      if (tls == null) {
        factory.setUri(uri);
      } else {
        // the amqps scheme would install a trust-everything context
        String plainUri =
            UriUtils.SCHEME_PLAIN + uri.toString().substring(uri.getScheme().length());
        factory.setUri(URI.create(plainUri));
        factory.setSocketConfigurator(
            SocketConfigurators.defaultConfigurator()
                .andThen(
                    socket -> {
                      if (socket instanceof SSLSocket) {
                        ((SSLSocket) socket).setEnabledProtocols(tls.protocolsArray());
                      }
                    }));
        factory.useSslProtocol(tls.sslContext());
        if (tls.hostnameVerification()) {
          factory.enableHostnameVerification();
        }
      }
    } catch (URISyntaxException | GeneralSecurityException e) {
      throw new IOException("Invalid broker URI: " + UriUtils.mask(uri), e);
    }
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    try {
      Connection connection = factory.newConnection(connectionName);
      LOGGER.debug("Connection '{}' opened to {}", connectionName, UriUtils.mask(uri));
      return new AmqpClientConnection(connection);
    } catch (TimeoutException e) {
      throw new IOException("Timed out while connecting to " + UriUtils.mask(uri), e);
    }
  }

  static CloseNotification notification(ShutdownSignalException cause) {
    if (cause.isInitiatedByApplication()) {
      return CloseNotification.deliberate(cause.getMessage());
    } else {
      return CloseNotification.unexpected(cause.getMessage(), cause);
    }
  }

  static final class AmqpClientConnection implements TransportConnection {

    private final Connection delegate;

    AmqpClientConnection(Connection delegate) {
      this.delegate = delegate;
    }

    @Override
    public TransportChannel openChannel() throws IOException {
      Channel channel = this.delegate.createChannel();
      if (channel == null) {
        throw new IOException("No channel available on connection " + this.delegate);
      }
      return new AmqpClientChannel(channel);
    }

    @Override
    public boolean isClosed() {
      return !this.delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
      if (this.delegate.isOpen()) {
        this.delegate.close();
      }
    }

    @Override
    public void addCloseListener(CloseListener listener) {
      this.delegate.addShutdownListener(cause -> listener.closed(notification(cause)));
    }

    @Override
    public String toString() {
      return this.delegate.toString();
    }
  }

  static final class AmqpClientChannel implements TransportChannel {

    private final Channel delegate;

    AmqpClientChannel(Channel delegate) {
      this.delegate = delegate;
    }

    @Override
    public void declareQueue(
        String name, boolean durable, boolean autoDelete, boolean exclusive, boolean noWait)
        throws IOException {
      if (noWait) {
        this.delegate.queueDeclareNoWait(name, durable, exclusive, autoDelete, null);
      } else {
        this.delegate.queueDeclare(name, durable, exclusive, autoDelete, null);
      }
    }

    @Override
    public void publish(
        String exchange,
        String routingKey,
        boolean mandatory,
        boolean immediate,
        OutboundMessage message)
        throws IOException {
      AMQP.BasicProperties properties =
          new AMQP.BasicProperties.Builder()
              .headers(message.headers())
              .contentType(message.contentType())
              .build();
      this.delegate.basicPublish(
          exchange, routingKey, mandatory, immediate, properties, message.body());
    }

    @Override
    public void close() throws IOException {
      if (this.delegate.isOpen()) {
        try {
          this.delegate.close();
        } catch (TimeoutException e) {
          throw new IOException("Timed out while closing channel " + this.delegate, e);
        }
      }
    }

    @Override
    public void addCloseListener(CloseListener listener) {
      this.delegate.addShutdownListener(cause -> listener.closed(notification(cause)));
    }

    @Override
    public String toString() {
      return this.delegate.toString();
    }
  }
}

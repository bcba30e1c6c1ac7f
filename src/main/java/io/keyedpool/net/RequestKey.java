/*
 * Copyright (c) 2011-2021 Contributors to the Eclipse Foundation
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
 * which is available at https://www.apache.org/licenses/LICENSE-2.0.
 *
 * SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 */
package io.keyedpool.net;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * Identifies a class of interchangeable connections: connections built for equal keys can serve each other's
 * requests.
 *
 * <p> Scheme and host are compared case insensitively, they are normalized to lower case.
 */
public final class RequestKey implements Comparable<RequestKey> {

  private final String scheme;
  private final String host;
  private final int port;

  private RequestKey(String scheme, String host, int port) {
    this.scheme = scheme;
    this.host = host;
    this.port = port;
  }

  public static RequestKey of(String scheme, String host, int port) {
    Objects.requireNonNull(scheme, "No null scheme accepted");
    Objects.requireNonNull(host, "No null host accepted");
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port " + port);
    }
    return new RequestKey(scheme.toLowerCase(Locale.ROOT), host.toLowerCase(Locale.ROOT), port);
  }

  /**
   * Derive the key of an absolute URI, the port defaults to the scheme port when the URI does not carry one.
   *
   * @param uri the absolute URI
   * @return the key
   * @throws IllegalArgumentException when the URI has no scheme or host, or the scheme has no default port
   */
  public static RequestKey of(URI uri) {
    String scheme = uri.getScheme();
    String host = uri.getHost();
    if (scheme == null || host == null) {
      throw new IllegalArgumentException("Not an absolute URI: " + uri);
    }
    int port = uri.getPort();
    if (port == -1) {
      port = defaultPort(scheme);
    }
    return of(scheme, host, port);
  }

  public static RequestKey of(String uri) {
    return of(URI.create(uri));
  }

  private static int defaultPort(String scheme) {
    switch (scheme.toLowerCase(Locale.ROOT)) {
      case "http":
      case "ws":
        return 80;
      case "https":
      case "wss":
        return 443;
      default:
        throw new IllegalArgumentException("No default port for scheme " + scheme);
    }
  }

  public String scheme() {
    return scheme;
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  /**
   * @return whether connections for this key use TLS
   */
  public boolean isSecure() {
    return "https".equals(scheme) || "wss".equals(scheme);
  }

  @Override
  public int compareTo(RequestKey o) {
    int cmp = scheme.compareTo(o.scheme);
    if (cmp == 0) {
      cmp = host.compareTo(o.host);
      if (cmp == 0) {
        cmp = Integer.compare(port, o.port);
      }
    }
    return cmp;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RequestKey)) {
      return false;
    }
    RequestKey that = (RequestKey) o;
    return port == that.port && scheme.equals(that.scheme) && host.equals(that.host);
  }

  @Override
  public int hashCode() {
    int result = scheme.hashCode();
    result = 31 * result + host.hashCode();
    result = 31 * result + port;
    return result;
  }

  @Override
  public String toString() {
    return scheme + "://" + host + ":" + port;
  }
}

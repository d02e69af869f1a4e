package com.codeheadsystems.hawk.model;

import com.codeheadsystems.hawk.exceptions.HawkError;
import com.codeheadsystems.hawk.exceptions.HawkException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * The facts of one HTTP request that a Hawk MAC covers, plus the optional attributes sent with it.
 * Fully validated at construction; the {@code with*} methods return modified copies.
 *
 * @param method the HTTP method, as sent (normally upper-case)
 * @param host   the host, as sent (normally lower-case)
 * @param port   the port
 * @param path   the path including any query string
 * @param hash   the payload hash, may be null
 * @param ext    application-specific data, may be null
 * @param app    the application id, may be null
 * @param dlg    the delegated-by application id, may be null
 */
public record Request(String method, String host, int port, String path, byte[] hash, String ext,
                      String app, String dlg) {

  public Request {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(path, "path");
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Port out of range: " + port);
    }
    checkHeaderValue("ext", ext);
    checkHeaderValue("app", app);
    checkHeaderValue("dlg", dlg);
    hash = hash == null ? null : hash.clone();
  }

  /**
   * Creates a request with no hash, ext, app or dlg.
   *
   * @param method the method
   * @param host   the host
   * @param port   the port
   * @param path   the path and query
   * @return the request
   */
  public static Request of(String method, String host, int port, String path) {
    return new Request(method, host, port, path, null, null, null, null);
  }

  /**
   * Creates a request from an absolute http or https URL. When the URL has no explicit port the
   * scheme's default is used.
   *
   * @param method the method
   * @param url    the absolute URL
   * @return the request
   * @throws HawkException with {@link HawkError#INVALID_URL} if host, port or path cannot be derived
   */
  public static Request fromUrl(String method, String url) {
    Objects.requireNonNull(url, "url");
    try {
      return fromUri(method, new URI(url));
    } catch (URISyntaxException e) {
      throw new HawkException(HawkError.INVALID_URL, "Invalid URL: " + url, e);
    }
  }

  /**
   * Creates a request from an absolute http or https URI.
   *
   * @param method the method
   * @param uri    the absolute URI
   * @return the request
   * @throws HawkException with {@link HawkError#INVALID_URL} if host, port or path cannot be derived
   */
  public static Request fromUri(String method, URI uri) {
    Objects.requireNonNull(uri, "uri");
    String host = uri.getHost();
    if (host == null) {
      throw new HawkException(HawkError.INVALID_URL, "URL has no host: " + uri);
    }
    int port = uri.getPort() >= 0 ? uri.getPort() : defaultPort(uri);
    String path = uri.getRawPath();
    if (path == null) {
      throw new HawkException(HawkError.INVALID_URL, "URL has no path: " + uri);
    }
    if (path.isEmpty()) {
      path = "/";
    }
    if (uri.getRawQuery() != null) {
      path = path + "?" + uri.getRawQuery();
    }
    return of(method, host, port, path);
  }

  private static int defaultPort(URI uri) {
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    return switch (scheme) {
      case "http" -> 80;
      case "https" -> 443;
      default -> throw new HawkException(HawkError.INVALID_URL, "URL has no port: " + uri);
    };
  }

  private static void checkHeaderValue(String name, String value) {
    if (value != null && value.indexOf('"') >= 0) {
      throw new IllegalArgumentException("Request attribute '" + name + "' must not contain '\"'");
    }
  }

  @Override
  public byte[] hash() {
    return hash == null ? null : hash.clone();
  }

  public Request withPath(String path) {
    return new Request(method, host, port, path, hash, ext, app, dlg);
  }

  /**
   * Returns a copy carrying the given payload hash. The hash should always be computed from the
   * payload, never copied from a received header.
   *
   * @param hash the payload hash, may be null
   * @return the request
   */
  public Request withHash(byte[] hash) {
    return new Request(method, host, port, path, hash, ext, app, dlg);
  }

  public Request withExt(String ext) {
    return new Request(method, host, port, path, hash, ext, app, dlg);
  }

  public Request withApp(String app) {
    return new Request(method, host, port, path, hash, ext, app, dlg);
  }

  public Request withDlg(String dlg) {
    return new Request(method, host, port, path, hash, ext, app, dlg);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Request other
        && port == other.port
        && method.equals(other.method)
        && host.equals(other.host)
        && path.equals(other.path)
        && Arrays.equals(hash, other.hash)
        && Objects.equals(ext, other.ext)
        && Objects.equals(app, other.app)
        && Objects.equals(dlg, other.dlg);
  }

  @Override
  public int hashCode() {
    return Objects.hash(method, host, port, path, Arrays.hashCode(hash), ext, app, dlg);
  }

  @Override
  public String toString() {
    return "Request[" + method + " " + host + ":" + port + path + "]";
  }
}

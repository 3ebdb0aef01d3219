package com.codeheadsystems.sendkey.client.model;

import java.net.URI;

/**
 * Network connection details for a sendkey server.
 *
 * @param endpoint the base URI of the server (e.g. http://host:8080).
 */
public record ServerConnectionInfo(URI endpoint) {
}

package com.tqc.model;

import java.util.Objects;

/**
 * Broker endpoint identity. Equality is by broker id and address so that a node
 * decoded from two different responses lands on the same map key.
 */
public final class Node {

    private final int id;
    private final String host;
    private final int port;

    public Node(int id, String host, int port) {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("Broker host must not be empty");
        }
        this.id = id;
        this.host = host;
        this.port = port;
    }

    public int getId() {
        return id;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getAddress() {
        return host + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node)) {
            return false;
        }
        Node other = (Node) o;
        return id == other.id && port == other.port && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, host, port);
    }

    @Override
    public String toString() {
        return "Node{id=" + id + ", address='" + getAddress() + "'}";
    }
}

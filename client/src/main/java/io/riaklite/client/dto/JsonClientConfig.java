// file: client/src/main/java/io/riaklite/client/dto/JsonClientConfig.java
package io.riaklite.client.dto;

/**
 * JSON shape of a client configuration file. Every field is optional;
 * missing fields keep the built-in defaults.
 * Example:
 *   {
 *     "host": "riak-1.internal",
 *     "port": 8098,
 *     "prefix": "riak",
 *     "mapredPrefix": "mapred",
 *     "scheme": "https",
 *     "clientId": "billing-worker",
 *     "r": 2, "w": 2, "dw": 1,
 *     "keyStore": "/etc/riak/client.p12",
 *     "keyStorePassword": "changeit",
 *     "username": "ops",
 *     "password": "secret",
 *     "requestTimeoutMillis": 30000
 *   }
 */
public class JsonClientConfig {
    public String host;
    public Integer port;
    public String prefix;
    public String mapredPrefix;
    public String scheme;
    public String clientId;
    public Integer r;
    public Integer w;
    public Integer dw;
    public String keyStore;          // PKCS12 client key store, https only
    public String keyStorePassword;
    public String trustStore;        // optional PKCS12 trust store; JVM defaults otherwise
    public String trustStorePassword;
    public String username;          // basic auth
    public String password;
    public Long requestTimeoutMillis;
}

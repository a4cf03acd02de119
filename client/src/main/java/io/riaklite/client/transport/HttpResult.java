package io.riaklite.client.transport;

/**
 * Raw outcome of one HTTP exchange. Status codes are not interpreted here.
 */
public record HttpResult(int status, String body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}

package io.riaklite.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * JSON response for GET /{prefix}?buckets=true.
 * Example:
 *   {
 *     "buckets": ["users", "orders"]
 *   }
 * Newer nodes may add fields; only "buckets" is read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BucketListResponse {
    public List<String> buckets;
}

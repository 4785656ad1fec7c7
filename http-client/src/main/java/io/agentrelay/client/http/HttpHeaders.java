package io.agentrelay.client.http;

public interface HttpHeaders {

    /** HTTP Content-Type header name. */
    String CONTENT_TYPE = "Content-Type";
    /** JSON content type value. */
    String APPLICATION_JSON = "application/json";
    /** HTTP Accept header name. */
    String ACCEPT = "Accept";
    /** SSE event stream content type. */
    String EVENT_STREAM = "text/event-stream";
}

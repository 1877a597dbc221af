package com.davfx.wind.http;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Status line and header block, derived from the state of a resource at the time it is generated.
 */
public final class HttpResponse {
	
	public final HttpRequest request;
	public final int status;
	public final String reason;
	public final ImmutableMap<String, String> headers;
	
	public HttpResponse(HttpRequest request, int status, String reason, ImmutableMap<String, String> headers) {
		this.request = request;
		this.status = status;
		this.reason = reason;
		this.headers = headers;
	}
	public HttpResponse(HttpRequest request, int status, ImmutableMap<String, String> headers) {
		this(request, status, HttpMessage.of(status), headers);
	}
	
	public String version() {
		if ((request == null) || (request.version == null)) {
			return HttpSpecification.HTTP11;
		}
		return request.version;
	}
	
	public String raw() {
		StringBuilder b = new StringBuilder();
		b.append(version()).append(HttpSpecification.START_LINE_SEPARATOR).append(status).append(HttpSpecification.START_LINE_SEPARATOR).append(reason).append(HttpSpecification.CRLF);
		for (Map.Entry<String, String> e : headers.entrySet()) {
			b.append(e.getKey()).append(HttpSpecification.HEADER_KEY_VALUE_SEPARATOR).append(HttpSpecification.HEADER_BEFORE_VALUE).append(e.getValue()).append(HttpSpecification.CRLF);
		}
		b.append(HttpSpecification.CRLF);
		return b.toString();
	}
	
	@Override
	public String toString() {
		return "[status=" + status + ", reason=" + reason + ", headers=" + headers + "]";
	}
}

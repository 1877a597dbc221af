package com.davfx.wind.http;

/**
 * HTTP condition raised by handler code and turned into a response by the resource handling the request.
 */
public final class HttpException extends Exception {

	private static final long serialVersionUID = -6251932207751493016L;
	
	public final int status;

	public HttpException(int status) {
		super(status + " " + HttpMessage.of(status));
		this.status = status;
	}
	
	public static HttpException notFound() {
		return new HttpException(HttpStatus.NOT_FOUND);
	}
	public static HttpException methodNotAllowed() {
		return new HttpException(HttpStatus.METHOD_NOT_ALLOWED);
	}
	public static HttpException notModified() {
		return new HttpException(HttpStatus.NOT_MODIFIED);
	}
}

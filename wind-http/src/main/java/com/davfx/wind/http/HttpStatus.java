package com.davfx.wind.http;

public interface HttpStatus {

	int OK = 200;
	int NO_CONTENT = 204;
	int NOT_MODIFIED = 304;
	int BAD_REQUEST = 400;
	int FORBIDDEN = 403;
	int NOT_FOUND = 404;
	int METHOD_NOT_ALLOWED = 405;
	int INTERNAL_SERVER_ERROR = 500;

}

package com.davfx.wind.http;

public interface HttpSpecification {
	String HTTP10 = "HTTP/1.0";
	String HTTP11 = "HTTP/1.1";
	
	String CRLF = "\r\n";
	
	char START_LINE_SEPARATOR = ' ';
	
	char HEADER_KEY_VALUE_SEPARATOR = ':';
	char HEADER_BEFORE_VALUE = ' ';

	char VERSION_SEPARATOR = '/';
}

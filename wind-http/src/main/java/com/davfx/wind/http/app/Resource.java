package com.davfx.wind.http.app;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.davfx.wind.http.HttpConnection;
import com.davfx.wind.http.HttpContentType;
import com.davfx.wind.http.HttpException;
import com.davfx.wind.http.HttpHeaderKey;
import com.davfx.wind.http.HttpHeaderValue;
import com.davfx.wind.http.HttpLog;
import com.davfx.wind.http.HttpMessage;
import com.davfx.wind.http.HttpRequest;
import com.davfx.wind.http.HttpResponse;
import com.davfx.wind.http.HttpSpecification;
import com.davfx.wind.http.HttpStatus;
import com.davfx.wind.http.SendCallback;
import com.davfx.wind.http.dependencies.Dependencies;
import com.davfx.wind.util.ConfigUtils;
import com.google.common.base.Optional;
import com.google.common.io.BaseEncoding;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.typesafe.config.Config;

/**
 * HTTP web resource, handles one request.
 * <p>
 * Extend it and override the {@code handle*} method of each supported method. The handler writes with
 * {@link #write(Object)} then calls {@link #finish()}, possibly later and from another thread
 * (the resource is asynchronous by default). Call {@link #asynchronous(boolean) asynchronous(false)}
 * from {@link #initialize()} to have {@link #finish()} called when the handler returns.
 * <p>
 * {@link #finish()} sends what was written with a 200 status, or a 304 status without body if the
 * request {@code If-None-Match} equals the ETag of the written content.
 * {@link #sendResponse(int)} discards what was written and sends an error response.
 * Either of them may be called once, the connection is closed when the response is sent.
 * <p>
 * Methods to override:
 * <ul>
 * <li>{@link #initialize()}</li>
 * <li>{@link #handleGet()}, {@link #handlePost()}, {@link #handlePut()}, {@link #handleDelete()}, {@link #handleHead()}</li>
 * <li>{@link #errorMessage()}</li>
 * <li>{@link #etagAvailable()}</li>
 * </ul>
 */
public class Resource {

	private static final Logger LOGGER = LoggerFactory.getLogger(Resource.class);

	private static final Config CONFIG = ConfigUtils.load(new Dependencies(), HttpSpecification.class);
	private static final Charset CHARSET = Charset.forName(CONFIG.getString("charset"));
	private static final String ETAG_DIGEST = CONFIG.getString("etag.digest");

	private static final Gson GSON = new Gson();

	public static enum State {
		NEW,
		PROCESSING,
		HANDLING,
		FINISHING,
		SENT,
		CLEARED
	}

	private Path path = null;
	private HttpLog log = null;
	private ResourceDeadline deadline = null;
	private HttpFunction synchronousHandler = null;

	private State state = State.NEW;
	private boolean processing = false;
	private boolean asynchronous = true;
	private HttpConnection connection = null;
	private HttpRequest request = null;
	private HttpResponse response = null;
	private int statusCode = HttpStatus.OK;
	private final WriteBuffer writeBuffer = new WriteBuffer();
	private final HttpResponseHeaders responseHeaders = new HttpResponseHeaders();
	private Future<?> armedDeadline = null;

	public Resource() {
	}

	/**
	 * Hook called once, when the resource has just been created for a request.
	 */
	protected void initialize() {
	}

	protected void handleGet() throws Exception {
		throw HttpException.methodNotAllowed();
	}

	protected void handlePost() throws Exception {
		throw HttpException.methodNotAllowed();
	}

	protected void handlePut() throws Exception {
		throw HttpException.methodNotAllowed();
	}

	protected void handleDelete() throws Exception {
		throw HttpException.methodNotAllowed();
	}

	protected void handleHead() throws Exception {
		throw HttpException.methodNotAllowed();
	}

	/**
	 * Body of the responses sent by {@link #sendResponse(int)}, written as by {@link #write(Object)}.
	 */
	protected Object errorMessage() {
		return defaultErrorMessage();
	}

	private String defaultErrorMessage() {
		return statusCode + " " + HttpMessage.of(statusCode);
	}

	/**
	 * There is no ETag in HTTP/1.0 (RFC 1945).
	 * Override to return {@code false} to disable cache validation for this resource.
	 */
	protected boolean etagAvailable() {
		return request.versionNumber() > 1.0d;
	}

	protected final void asynchronous(boolean asynchronous) {
		this.asynchronous = asynchronous;
	}

	protected final synchronized HttpRequest request() {
		return request;
	}

	public final synchronized State state() {
		return state;
	}

	public final synchronized boolean isProcessing() {
		return processing;
	}

	final void bind(Path path, HttpLog log, ResourceDeadline deadline) {
		this.path = path;
		this.log = log;
		this.deadline = deadline;
		initialize();
	}

	final void inject(HttpFunction function) {
		synchronousHandler = function;
	}

	public final void react(HttpConnection connection, HttpRequest request) {
		synchronized (this) {
			if (path == null) {
				throw new IllegalStateException("Resource must be created by a Path");
			}
			if (state != State.NEW) {
				throw new IllegalStateException("Resource already reacted: " + state);
			}
			state = State.PROCESSING;
			processing = true;
			this.connection = connection;
			this.request = request;
		}

		try {
			if (!path.isError() && !path.allowed(request.method)) {
				throw HttpException.methodNotAllowed();
			}

			synchronized (this) {
				state = State.HANDLING;
			}

			if (synchronousHandler != null) {
				Object chunk = synchronousHandler.apply(request);
				write(chunk);
				finish();
			} else {
				handle();
				if (!asynchronous) {
					finish();
				} else {
					armDeadline();
				}
			}
		} catch (Exception e) {
			fail(e);
		}
	}

	private void handle() throws Exception {
		switch (request.method) {
		case GET:
			handleGet();
			break;
		case POST:
			handlePost();
			break;
		case PUT:
			handlePut();
			break;
		case DELETE:
			handleDelete();
			break;
		case HEAD:
			handleHead();
			break;
		default:
			throw HttpException.methodNotAllowed();
		}
	}

	private void fail(Exception e) {
		if (e instanceof HttpException) {
			int status = ((HttpException) e).status;
			switch (status) {
			case HttpStatus.NOT_FOUND:
			case HttpStatus.METHOD_NOT_ALLOWED:
			case HttpStatus.NOT_MODIFIED:
				sendResponse(status);
				return;
			default:
				log.failure("Unhandled HTTP condition " + status + " for " + describe(), e);
				break;
			}
		} else {
			log.failure("Error while handling " + describe(), e);
		}
		sendResponse(HttpStatus.INTERNAL_SERVER_ERROR);
	}

	private synchronized String describe() {
		if (request == null) {
			return String.valueOf(path);
		}
		return request.method + " " + request.url;
	}

	private synchronized void armDeadline() {
		if ((state == State.PROCESSING) || (state == State.HANDLING)) {
			armedDeadline = deadline.arm(new Runnable() {
				@Override
				public void run() {
					expire();
				}
			});
		}
	}

	private synchronized void expire() {
		if ((state == State.PROCESSING) || (state == State.HANDLING)) {
			LOGGER.warn("Resource not finished after {} seconds: {}", deadline.timeout(), describe());
			sendResponse(HttpStatus.INTERNAL_SERVER_ERROR);
		}
	}

	/**
	 * A {@code Map} or a Gson {@code JsonElement} is written as JSON and switches the content type to JSON,
	 * {@code byte[]} and {@code ByteBuffer} are written as is, anything else as its string value.
	 * Null and empty chunks are ignored.
	 */
	public final void write(Object chunk) {
		write(chunk, false);
	}

	public final synchronized void write(Object chunk, boolean left) {
		if (chunk == null) {
			return;
		}

		ByteBuffer b;
		if ((chunk instanceof Map) || (chunk instanceof JsonElement)) {
			b = ByteBuffer.wrap(GSON.toJson(chunk).getBytes(CHARSET));
			responseHeaders.jsonContent();
		} else if (chunk instanceof byte[]) {
			b = ByteBuffer.wrap(((byte[]) chunk).clone());
		} else if (chunk instanceof ByteBuffer) {
			ByteBuffer source = ((ByteBuffer) chunk).duplicate();
			b = ByteBuffer.allocate(source.remaining());
			b.put(source);
			b.flip();
		} else {
			b = ByteBuffer.wrap(String.valueOf(chunk).getBytes(CHARSET));
		}

		if (left) {
			writeBuffer.appendLeft(b);
		} else {
			writeBuffer.append(b);
		}
	}

	public final synchronized void addResponseHeader(String key, String value) {
		responseHeaders.add(key, value);
	}

	public final synchronized void removeResponseHeader(String key) {
		responseHeaders.remove(key);
	}

	/**
	 * Status sent by {@link #finish()}, 200 if never set.
	 */
	public final synchronized void setStatusCode(int statusCode) {
		this.statusCode = statusCode;
	}

	private boolean complete(String operation) {
		if ((state == State.PROCESSING) || (state == State.HANDLING)) {
			state = State.FINISHING;
			return true;
		}
		LOGGER.warn("Ignoring {} of {}, resource is {}", operation, describe(), state);
		return false;
	}

	/**
	 * Sends what was written.
	 */
	public final synchronized void finish() {
		if (!complete("finish")) {
			return;
		}

		try {
			if (etagAvailable()) {
				String etag = generateEtag();
				Optional<String> requestEtag = getEtag();
				if (requestEtag.isPresent() && requestEtag.get().equals(etag)) {
					LOGGER.trace("Not modified: {}", describe());
					respondWithError(HttpStatus.NOT_MODIFIED);
					return;
				}
				setEtag(etag);
			}

			if (!writeBuffer.isEmpty()) {
				responseHeaders.contentLength(writeBuffer.totalBytes());
			}

			send();
		} catch (RuntimeException e) {
			abort(e);
		}
	}

	/**
	 * Sends a response without what was written.
	 * The body is {@link #errorMessage()} unless the status forbids a body.
	 */
	public final synchronized void sendResponse(int statusCode) {
		if (!complete("response " + statusCode)) {
			return;
		}
		respondWithError(statusCode);
	}

	public final void sendResponse() {
		sendResponse(HttpStatus.OK);
	}

	private void discardBody() {
		writeBuffer.clear();
		responseHeaders.remove(HttpHeaderKey.CONTENT_LENGTH);
		responseHeaders.remove(HttpHeaderKey.CONTENT_TYPE);
		responseHeaders.remove(HttpHeaderKey.ETAG);
	}

	private void measureBody() {
		if (!writeBuffer.isEmpty()) {
			if (responseHeaders.get(HttpHeaderKey.CONTENT_TYPE) == null) {
				responseHeaders.add(HttpHeaderKey.CONTENT_TYPE, HttpContentType.plainText(CHARSET));
			}
			responseHeaders.contentLength(writeBuffer.totalBytes());
		}
	}

	private void respondWithError(int statusCode) {
		try {
			discardBody();
			setStatusCode(statusCode);
			if (bodyAllowed(statusCode)) {
				Object message;
				try {
					message = errorMessage();
				} catch (RuntimeException e) {
					log.failure("Could not build error message for " + describe(), e);
					message = defaultErrorMessage();
				}
				write(message);
				measureBody();
			}
			send();
		} catch (RuntimeException e) {
			abort(e);
		}
	}

	// Fixed 500 response, without calling any overridable method
	private void abort(RuntimeException e) {
		log.failure("Could not complete " + describe(), e);
		if (state != State.FINISHING) {
			closeAfterFailure();
			return;
		}
		try {
			discardBody();
			setStatusCode(HttpStatus.INTERNAL_SERVER_ERROR);
			write(defaultErrorMessage());
			measureBody();
			send();
		} catch (RuntimeException re) {
			LOGGER.warn("Could not send failure response to {}", describe(), re);
			closeAfterFailure();
		}
	}

	private void closeAfterFailure() {
		if (state != State.CLEARED) {
			state = State.SENT;
			clear();
		}
	}

	private static boolean bodyAllowed(int statusCode) {
		return (statusCode >= HttpStatus.OK) && (statusCode != HttpStatus.NO_CONTENT) && (statusCode != HttpStatus.NOT_MODIFIED);
	}

	/**
	 * Must be generated again if the headers change after it is called.
	 */
	private void generateResponse() {
		if (responseHeaders.get(HttpHeaderKey.CONNECTION) == null) {
			responseHeaders.add(HttpHeaderKey.CONNECTION, HttpHeaderValue.CLOSE);
		}
		response = new HttpResponse(request, statusCode, responseHeaders.toMap());
	}

	private void send() {
		generateResponse();
		write(response.raw(), true);
		writeBuffer.gather(writeBuffer.totalBytes());
		ByteBuffer payload = writeBuffer.popLeft();
		state = State.SENT;
		LOGGER.trace("Sending {} bytes: {}", payload.remaining(), response);
		connection.write(payload, new SendCallback() {
			@Override
			public void sent() {
				clear();
			}
			@Override
			public void failed(IOException e) {
				LOGGER.warn("Could not send response to {}", describe(), e);
				clear();
			}
		});
	}

	private synchronized void clear() {
		if (state != State.SENT) {
			LOGGER.warn("Ignoring completion of {}, resource is {}", describe(), state);
			return;
		}
		if (armedDeadline != null) {
			armedDeadline.cancel(false);
			armedDeadline = null;
		}
		connection.close();
		logAccess();
		processing = false;
		connection = null;
		request = null;
		writeBuffer.clear();
		responseHeaders.clear();
		state = State.CLEARED;
	}

	private void logAccess() {
		if ((request != null) && (response != null)) {
			log.access(request.method + " " + request.url + " " + response.status);
		}
	}

	// If-None-Match of the request
	private Optional<String> getEtag() {
		return request.ifNoneMatch();
	}

	private void setEtag(String etag) {
		responseHeaders.etag(etag);
	}

	/**
	 * Hexadecimal digest of the written chunks, in order.
	 */
	protected final synchronized String generateEtag() {
		MessageDigest digest;
		try {
			digest = MessageDigest.getInstance(ETAG_DIGEST);
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("Unsupported ETag digest: " + ETAG_DIGEST, e);
		}
		for (ByteBuffer chunk : writeBuffer) {
			digest.update(chunk);
		}
		return BaseEncoding.base16().lowerCase().encode(digest.digest());
	}
}

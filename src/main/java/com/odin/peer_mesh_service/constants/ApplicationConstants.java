package com.odin.peer_mesh_service.constants;

public class ApplicationConstants {

	public static final String API_VERSION = "/v1";
	public static final String SESSION = "/session";
	public static final String EVENTS = "/events";
	public static final String JOIN = "/join";
	public static final String LEAVE = "/leave";
	public static final String SNAPSHOT = "/snapshot";
	public static final String TOPOLOGY = "/topology";
	public static final String AUDIO_TOGGLE = "/audio/toggle";
	public static final String VIDEO_TOGGLE = "/video/toggle";
	public static final String SCREEN_SHARE_START = "/screen-share/start";
	public static final String SCREEN_SHARE_STOP = "/screen-share/stop";
	public static final String USERNAME = "/username";
	public static final String BROADCAST = "/broadcast";
	public static final String RECONNECT = "/reconnect";
	public static final String TRANSITIONS = "/transitions";
	public static final String RECORDING_START = "/recording/start";
	public static final String RECORDING_STOP = "/recording/stop";

	// Peer id conventions
	public static final String CREATOR_SUFFIX = "-creator";
	public static final String DEFAULT_USERNAME = "Guest";

	// MDC key carrying the local peer id
	public static final String MDC_PEER_ID = "peerId";

	// Control-channel envelope
	public static final String FIELD_TYPE = "type";
	public static final String FIELD_TIMESTAMP = "timestamp";

	// Control-channel message types
	public static final String MESSAGE_TYPE_USERNAME = "username";
	public static final String MESSAGE_TYPE_REQUEST_USERNAME = "request-username";
	public static final String MESSAGE_TYPE_PEER_LIST = "peer-list";
	public static final String MESSAGE_TYPE_REQUEST_PEER_LIST = "request-peer-list";
	public static final String MESSAGE_TYPE_NEW_PEER = "new-peer";
	public static final String MESSAGE_TYPE_PEER_DISCONNECT = "peer-disconnect";
	public static final String MESSAGE_TYPE_SCREEN_SHARING_STATUS = "screen-sharing-status";
	public static final String MESSAGE_TYPE_SCREEN_SHARING_STREAM = "screen-sharing-stream";
	public static final String MESSAGE_TYPE_SCREEN_SHARE_STARTED = "screen-share-started";
	public static final String MESSAGE_TYPE_SCREEN_SHARE_RETRY_NEEDED = "screen-share-retry-needed";
	public static final String MESSAGE_TYPE_SCREEN_SHARE_CONFIRMED = "screen-share-confirmed";
	public static final String MESSAGE_TYPE_STREAM_METADATA = "stream-metadata";
	public static final String MESSAGE_TYPE_REQUEST_SCREEN_STREAM = "request-screen-stream";
	public static final String MESSAGE_TYPE_REQUEST_STREAM_UPDATE = "request-stream-update";
	public static final String MESSAGE_TYPE_CAMERA_STREAM_RESTORED = "camera-stream-restored";
	public static final String MESSAGE_TYPE_CAMERA_STREAM_SENT = "camera-stream-sent";
	public static final String MESSAGE_TYPE_RECONNECT_AFTER_SCREEN_SHARE = "reconnect-after-screen-share";
	public static final String MESSAGE_TYPE_REQUEST_FULL_RECONNECT = "request-full-reconnect";
	public static final String MESSAGE_TYPE_CHAT = "chat-message";
	public static final String MESSAGE_TYPE_RECORDING_STATUS = "recording-status";

	// Media channel metadata keys
	public static final String METADATA_USERNAME = "username";
	public static final String METADATA_STREAM_TYPE = "streamType";

	// UI event stream
	public static final String UI_EVENT_SNAPSHOT = "snapshot";
	public static final String UI_EVENT_DATA = "data";
	public static final String UI_EVENT_ERROR = "error";
	public static final String UI_FIELD_EVENT = "event";
	public static final String UI_FIELD_ACTION = "action";

}

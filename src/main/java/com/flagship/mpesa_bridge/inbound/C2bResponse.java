package com.flagship.mpesa_bridge.inbound;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The two-field answer Daraja expects from C2B validation and confirmation URLs.
 * Always sent with HTTP 200.
 */
public record C2bResponse(@JsonProperty("ResultCode") int resultCode,
                          @JsonProperty("ResultDesc") String resultDesc) {

    public static final C2bResponse ACCEPT = new C2bResponse(0, "Accept");
    public static final C2bResponse REJECT = new C2bResponse(1, "Reject");
    public static final C2bResponse SUCCESS = new C2bResponse(0, "Success");
    public static final C2bResponse FAILED = new C2bResponse(1, "Failed");
}

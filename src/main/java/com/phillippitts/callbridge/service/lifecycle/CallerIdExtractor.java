package com.phillippitts.callbridge.service.lifecycle;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads caller details from the SIP headers of an incoming call ({@code [{name, value}, ...]}).
 */
final class CallerIdExtractor {

    static final String UNKNOWN_CALLER = "unknown";

    private static final Pattern PHONE = Pattern.compile("\\+?(\\d{10,})");
    private static final String FROM_HEADER = "From";
    private static final String CARRIER_CALL_SID_HEADER = "X-Twilio-CallSid";

    private CallerIdExtractor() {}

    /**
     * Digits of the caller's number from the {@code From} header (leading {@code +} dropped),
     * or {@code "unknown"} when there is no number of at least ten digits.
     */
    static String callerNumber(JSONArray sipHeaders) {
        String from = header(sipHeaders, FROM_HEADER).orElse("");
        Matcher m = PHONE.matcher(from);
        return m.find() ? m.group(1) : UNKNOWN_CALLER;
    }

    /**
     * Carrier-side call id, when the carrier forwards one.
     */
    static Optional<String> carrierCallSid(JSONArray sipHeaders) {
        return header(sipHeaders, CARRIER_CALL_SID_HEADER);
    }

    private static Optional<String> header(JSONArray sipHeaders, String name) {
        if (sipHeaders == null) {
            return Optional.empty();
        }
        for (int i = 0; i < sipHeaders.length(); i++) {
            JSONObject h = sipHeaders.optJSONObject(i);
            if (h != null && name.equals(h.optString("name"))) {
                String value = h.optString("value", "");
                return value.isEmpty() ? Optional.empty() : Optional.of(value);
            }
        }
        return Optional.empty();
    }
}

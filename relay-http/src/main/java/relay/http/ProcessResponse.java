package relay.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response body of the processing endpoint. Unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ProcessResponse(boolean ok, Integer processed, Integer pending, ErrorBody error) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ErrorBody(Integer code, String message) {
  }

  String errorMessage() {
    if (error == null || error.message() == null) {
      return "Unknown error";
    }
    return error.message();
  }
}

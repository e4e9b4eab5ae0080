/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.vibecloud.room.exception;

/**
 * Failure raised while handling a signaling request. The {@link Code} tells the transport layer how
 * the failure is reported back to the client.
 */
public class SignalingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Code {
        GENERIC_ERROR_CODE(999),
        INVALID_MESSAGE_ERROR_CODE(101),
        UNKNOWN_METHOD_ERROR_CODE(102),
        USER_ID_REQUIRED_ERROR_CODE(201);

        private final int value;

        Code(int value) {
            this.value = value;
        }

        public int getValue() {
            return value;
        }
    }

    private final Code code;

    public SignalingException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public SignalingException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Code getCode() {
        return code;
    }

    public int getCodeValue() {
        return code.getValue();
    }

    @Override
    public String toString() {
        return "Code: " + getCodeValue() + " " + super.toString();
    }
}

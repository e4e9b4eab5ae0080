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

package org.vibecloud.room.api.pojo;

/**
 * Answer sent back to the client for a request that expects one. Failures carry a human readable
 * {@code error}; successful answers may carry extra fields in subclasses.
 */
public class Acknowledgement {
    private final boolean success;
    private final String error;

    protected Acknowledgement(boolean success, String error) {
        this.success = success;
        this.error = error;
    }

    public static Acknowledgement ok() {
        return new Acknowledgement(true, null);
    }

    public static Acknowledgement failure(String error) {
        return new Acknowledgement(false, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return success ? "Acknowledgement{success}" : "Acknowledgement{error='" + error + "'}";
    }
}

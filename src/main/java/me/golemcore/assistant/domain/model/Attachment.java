/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.assistant.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Binary payload attached to a user message (photo, document). Attachments
 * are carried through history but not counted by the token estimator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Attachment {

    public enum Type {
        IMAGE, DOCUMENT
    }

    private Type type;
    private byte[] data;
    private String filename;
    private String mimeType;
    private String caption;

    public boolean isImage() {
        return type == Type.IMAGE && data != null && data.length > 0;
    }
}

package me.golemcore.careergraph.domain.exception;

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

/**
 * The single exception type the graph engine lets escape to callers. Carries a
 * {@link GraphErrorKind} so inbound adapters can translate it without parsing
 * messages.
 */
public class GraphException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final GraphErrorKind kind;

    public GraphException(GraphErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GraphException(GraphErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public GraphErrorKind getKind() {
        return kind;
    }

    public static GraphException notFound(String message) {
        return new GraphException(GraphErrorKind.NOT_FOUND, message);
    }

    public static GraphException invalidType(String message) {
        return new GraphException(GraphErrorKind.INVALID_TYPE, message);
    }

    public static GraphException sourceInvalid(String message) {
        return new GraphException(GraphErrorKind.SOURCE_INVALID, message);
    }

    public static GraphException sourceInvalid(String message, Throwable cause) {
        return new GraphException(GraphErrorKind.SOURCE_INVALID, message, cause);
    }
}

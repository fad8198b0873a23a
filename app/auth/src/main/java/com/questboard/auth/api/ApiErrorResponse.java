/*
 * どこで: app/auth/src/main/java/com/questboard/auth/api/ApiErrorResponse.java
 * 何を: API エラー応答の共通 DTO
 * なぜ: エラー形式を統一し、クライアント側で機械的に処理できるようにするため
 */
package com.questboard.auth.api;

public record ApiErrorResponse(String code, String message) {}

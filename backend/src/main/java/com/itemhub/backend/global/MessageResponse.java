package com.itemhub.backend.global;

/** 삭제 등 본문이 필요 없는 성공 응답: {"message": "..."} */
public record MessageResponse(String message) {}

package com.chainexplorer.api.dto;

public record CommandAcceptedResponse(String command, String message) {
}

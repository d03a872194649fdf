package com.cryptofolio.backend.dto;

public record AssetOption(String name, String assetId) {}

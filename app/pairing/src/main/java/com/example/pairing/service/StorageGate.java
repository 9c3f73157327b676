package com.example.pairing.service;

/** コア操作の前に参照する、ストレージ疎通可否のゲート。 */
public interface StorageGate {

  boolean isAvailable();
}

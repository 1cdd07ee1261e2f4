package com.example.courtalert.model;

public enum GateDecision {
  SEND,
  SUPPRESS
}

package com.example.courtalert.model;

public enum TransitionKind {
  OPENED,
  CLOSED
}

package com.quantori.mge.api.model;

public enum Hybridization {
  SP,
  SP2,
  SP3,
  OTHER
}

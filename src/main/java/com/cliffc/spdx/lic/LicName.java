package com.cliffc.spdx.lic;

// The license part of a simple license expression: either a registered
// LicenseId or a free-form LicenseRef.
public interface LicName {
  // True for a registered SPDX identifier
  boolean registered();
}

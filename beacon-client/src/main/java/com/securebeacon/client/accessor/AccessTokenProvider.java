package com.securebeacon.client.accessor;

/**
 * Supplies the bearer credential issued by the identity provider for the signed-in user.
 */
@FunctionalInterface
public interface AccessTokenProvider {

  /**
   * Returns a currently valid access token, without the {@code Bearer } prefix.
   *
   * @return the access token
   */
  String accessToken();
}

/*
 * どこで: Assignment API
 * 何を: 参照先 (作業者/住宅/割当) の未検出を表す
 * なぜ: 404 応答へ変換するため
 */
package com.taskmeister.assignment.api;

public class NotFoundException extends RuntimeException {

  public NotFoundException(String resource, String id) {
    super(resource + " not found: " + id);
  }
}

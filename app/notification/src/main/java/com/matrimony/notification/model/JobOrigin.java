package com.matrimony.notification.model;

public enum JobOrigin {
  /** 起動時に設定から登録される。削除されない。 */
  STATIC,
  /** 管理操作で作成される。無効化のみで削除しない。 */
  DYNAMIC
}

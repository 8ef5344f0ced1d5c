package com.anyllm.gateway.auth.verify;

/**
 * 社群登入的 provider 端驗證。每個 provider 一個 bean，provider() 不可重複。
 */
public interface ProfileVerifier {

    /** 小寫 provider 名稱，如 "google" */
    String provider();

    /**
     * 驗證 provider 的 token 並回傳正規化後的 profile。
     * token 無效時回 null 或丟例外都視為驗證失敗。
     */
    VerifiedProfile verify(String accessToken) throws Exception;
}

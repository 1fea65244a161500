package com.sentinel.enginehealth.compiler.store;

import com.sentinel.enginehealth.api.IResolvedProfileCache;
import com.sentinel.enginehealth.api.exceptions.ProfileNotFoundException;
import com.sentinel.enginehealth.api.exceptions.ProfileStoreException;
import com.sentinel.enginehealth.api.model.Profile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class InMemoryProfileStoreTest {

    @Mock
    private IResolvedProfileCache cache;

    private InMemoryProfileStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryProfileStore(cache);
    }

    @Test
    @DisplayName("Should store and list profiles in id order")
    void shouldSaveAndList() {
        store.save(Profile.of("zeta", null, null, null));
        store.save(Profile.of("alpha", "zeta", null, null));

        assertThat(store.listProfileIds()).containsExactly("alpha", "zeta");
        assertThat(store.getProfile("alpha")).get().extracting(Profile::parentId).isEqualTo("zeta");
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should invalidate cached resolutions on save")
    void shouldInvalidateOnSave() {
        store.save(Profile.of("root", null, null, null));

        verify(cache).invalidate("root");
    }

    @Test
    @DisplayName("Should reject an invalid profile without touching the cache")
    void shouldRejectInvalidProfile() {
        assertThatThrownBy(() -> store.save(Profile.of("Bad Id", null, null, null)))
                .isInstanceOf(ProfileStoreException.class);

        assertThat(store.size()).isZero();
        verifyNoInteractions(cache);
    }

    @Test
    @DisplayName("Should refuse to remove a profile that still has children")
    void shouldRefuseRemovingParent() {
        store.save(Profile.of("root", null, null, null));
        store.save(Profile.of("child", "root", null, null));

        assertThatThrownBy(() -> store.remove("root"))
                .isInstanceOf(ProfileStoreException.class)
                .hasMessageContaining("[child]");

        store.remove("child");
        store.remove("root");
        assertThat(store.listProfileIds()).isEmpty();
    }

    @Test
    @DisplayName("Should fail to remove an unknown profile")
    void shouldFailRemovingUnknown() {
        assertThatThrownBy(() -> store.remove("ghost")).isInstanceOf(ProfileNotFoundException.class);
    }
}

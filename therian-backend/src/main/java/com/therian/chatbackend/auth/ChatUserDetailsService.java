package com.therian.chatbackend.auth;

import com.therian.chatbackend.user.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ChatUserDetailsService implements UserDetailsService {

    private final UserRepository userRepository;
    private final AdminIdentity adminIdentity;

    @Override
    public UserDetails loadUserByUsername(String identityId) {
        return userRepository.findById(identityId)
                .map(user -> new CustomUserDetails(user, adminIdentity.isAdmin(user.getId())))
                .orElseThrow(() -> new UsernameNotFoundException("Unknown identity " + identityId));
    }
}
